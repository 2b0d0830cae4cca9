package com.scholary.video2mp3.api;

/** Admin cleanup request. A missing or zero {@code retentionDays} uses the configured default. */
public record CleanupRequest(Integer retentionDays) {}
