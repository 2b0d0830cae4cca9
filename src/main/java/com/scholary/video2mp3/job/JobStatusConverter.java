package com.scholary.video2mp3.job;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/** Persists {@link JobStatus} as its lowercase wire value. */
@Converter
public class JobStatusConverter implements AttributeConverter<JobStatus, String> {

  @Override
  public String convertToDatabaseColumn(JobStatus status) {
    return status == null ? null : status.value();
  }

  @Override
  public JobStatus convertToEntityAttribute(String value) {
    return value == null ? null : JobStatus.fromValue(value);
  }
}
