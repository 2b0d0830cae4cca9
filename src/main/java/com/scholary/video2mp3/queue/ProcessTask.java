package com.scholary.video2mp3.queue;

/** A request to run the conversion pipeline for one job. Carries no state of its own. */
public record ProcessTask(String jobId, String sourceUrl) {}
