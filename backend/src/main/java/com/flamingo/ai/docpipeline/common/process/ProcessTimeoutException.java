package com.flamingo.ai.docpipeline.common.process;

import java.io.IOException;
import java.time.Duration;

/** Thrown when an external process does not exit within its time limit. It has been killed. */
public class ProcessTimeoutException extends IOException {

  private final String processName;
  private final Duration timeout;

  public ProcessTimeoutException(String processName, Duration timeout) {
    super(processName + " process timed out after " + timeout.toMillis() + " ms");
    this.processName = processName;
    this.timeout = timeout;
  }

  public String getProcessName() {
    return processName;
  }

  public Duration getTimeout() {
    return timeout;
  }
}
