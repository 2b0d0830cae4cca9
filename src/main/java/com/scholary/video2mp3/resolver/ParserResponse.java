package com.scholary.video2mp3.resolver;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Body returned by {@code POST /api/parse}. */
@JsonIgnoreProperties(ignoreUnknown = true)
record ParserResponse(
    @JsonProperty("retcode") int retcode,
    @JsonProperty("retdesc") String retdesc,
    @JsonProperty("succ") boolean succ,
    @JsonProperty("data") Data data) {

  @JsonIgnoreProperties(ignoreUnknown = true)
  record Data(
      @JsonProperty("video_id") String videoId,
      @JsonProperty("platform") String platform,
      @JsonProperty("title") String title,
      @JsonProperty("video_url") String videoUrl,
      @JsonProperty("cover_url") String coverUrl,
      @JsonProperty("audio_url") String audioUrl) {}
}
