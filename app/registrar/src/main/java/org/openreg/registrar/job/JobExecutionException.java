/*
 * どこで: Registrar ジョブ実行
 * 何を: ジョブを FAILED で終わらせる失敗を表現する
 * なぜ: 失敗種別と要約情報をエラー成果物へ載せるため
 */
package org.openreg.registrar.job;

import java.time.Instant;
import java.util.Map;

public class JobExecutionException extends RuntimeException {

  public enum FailureCode {
    DOWNSTREAM_FAILURE,
    CANCELLED,
    TIMED_OUT,
    INVALID_INPUT,
    INTERNAL_ERROR
  }

  private final FailureCode code;
  private final Map<String, Object> details;

  public JobExecutionException(
      FailureCode code, String message, Map<String, Object> details, Throwable cause) {
    super(message, cause);
    this.code = code;
    this.details = details == null ? Map.of() : Map.copyOf(details);
  }

  public static JobExecutionException cancelled() {
    return new JobExecutionException(
        FailureCode.CANCELLED, "job was cancelled by request", Map.of(), null);
  }

  public static JobExecutionException timedOut(Instant deadline) {
    return new JobExecutionException(
        FailureCode.TIMED_OUT,
        "job exceeded its deadline",
        Map.of("deadline", deadline.toString()),
        null);
  }

  public FailureCode code() {
    return code;
  }

  public Map<String, Object> details() {
    return details;
  }
}
