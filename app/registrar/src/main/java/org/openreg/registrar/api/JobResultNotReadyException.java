package org.openreg.registrar.api;

public class JobResultNotReadyException extends RuntimeException {

  public JobResultNotReadyException(String jobId, String state) {
    super("job result is not available: job_id=" + jobId + " state=" + state);
  }
}
