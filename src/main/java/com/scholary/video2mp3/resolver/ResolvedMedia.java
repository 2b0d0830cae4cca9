package com.scholary.video2mp3.resolver;

/**
 * A direct, downloadable media URL for a share link.
 *
 * @param platform platform reported by the resolver, may be {@code null}
 * @param mediaUrl URL to download
 * @param kind whether the URL is an audio-only stream or a full video
 */
public record ResolvedMedia(String platform, String mediaUrl, MediaKind kind) {}
