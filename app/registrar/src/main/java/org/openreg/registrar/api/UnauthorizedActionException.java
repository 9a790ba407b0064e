/*
 * どこで: Registrar API
 * 何を: 権限不足による拒否を表現する
 * なぜ: 403 応答へ変換するため
 */
package org.openreg.registrar.api;

public class UnauthorizedActionException extends RuntimeException {

  public UnauthorizedActionException(String message) {
    super(message);
  }
}
