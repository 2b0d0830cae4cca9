package com.scholary.video2mp3.api;

public record CleanupResponse(long deletedJobs, int deletedObjects) {}
