package com.scholary.video2mp3.resolver;

/** What a resolved media URL points at, which decides the scratch file's extension. */
public enum MediaKind {
  AUDIO(".m4a"),
  VIDEO(".mp4");

  private final String extension;

  MediaKind(String extension) {
    this.extension = extension;
  }

  public String extension() {
    return extension;
  }
}
