/*
 * どこで: Registrar 成果物保存
 * 何を: 保存先の入出力失敗を表現する
 * なぜ: 実装ごとの例外型 (IOException, SdkException) を呼び出し側へ漏らさないため
 */
package org.openreg.registrar.store;

public class ResultStoreException extends RuntimeException {

  public ResultStoreException(String message) {
    super(message);
  }

  public ResultStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
