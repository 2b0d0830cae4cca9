package com.scholary.video2mp3.retention;

/** What a retention sweep removed. */
public record SweepResult(long rowsDeleted, int blobsDeleted) {}
