package com.scholary.video2mp3.service;

/** A ready job has no usable result reference. */
public class ResultNotFoundException extends RuntimeException {

  public ResultNotFoundException(String jobId) {
    super("mp3 not found for job " + jobId);
  }
}
