package com.flamingo.ai.docpipeline.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/** Lifecycle status shared by chunked jobs and progress records. */
public enum JobStatus {
  /** Work has been accepted and is still running. */
  PROCESSING("processing"),

  /** Every unit finished successfully. */
  COMPLETED("completed"),

  /** At least one unit failed terminally, or the whole job could not run. */
  ERROR("error");

  private final String value;

  JobStatus(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  public boolean isTerminal() {
    return this != PROCESSING;
  }
}
