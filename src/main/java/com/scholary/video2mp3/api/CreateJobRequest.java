package com.scholary.video2mp3.api;

import jakarta.validation.constraints.NotBlank;

/**
 * Request to convert a video.
 *
 * <p>{@code url} may be a bare link or the text a share sheet produces around it.
 */
public record CreateJobRequest(@NotBlank(message = "url is required") String url) {}
