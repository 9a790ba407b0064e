/*
 * どこで: Registrar API
 * 何を: ジョブ状態遷移の違反を表現する
 * なぜ: 不正遷移や競合で状態が変わらなかったことを呼び出し元へ伝えるため
 */
package org.openreg.registrar.api;

public class InvalidJobTransitionException extends RuntimeException {

  public InvalidJobTransitionException(String message) {
    super(message);
  }
}
