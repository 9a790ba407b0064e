/*
 * どこで: Registrar 下流連携
 * 何を: 登録データ提供元の致命的な失敗を表現する
 * なぜ: ジョブを FAILED で終わらせる失敗と項目単位の失敗を区別するため
 */
package org.openreg.registrar.lms;

public class DownstreamFailureException extends RuntimeException {

  public enum Reason {
    TIMEOUT,
    UNAVAILABLE,
    UNAUTHORIZED,
    SERVER_ERROR,
    CLIENT_ERROR,
    INVALID_RESPONSE
  }

  private final Reason reason;

  public DownstreamFailureException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public DownstreamFailureException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }

  /** バッチ単位で項目を内部エラー扱いにして継続できる失敗か。 */
  public boolean isBatchScoped() {
    return reason == Reason.CLIENT_ERROR;
  }
}
