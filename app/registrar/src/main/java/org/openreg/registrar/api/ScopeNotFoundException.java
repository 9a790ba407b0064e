/*
 * どこで: Registrar API
 * 何を: 組織/プログラムの未検出を表現する
 * なぜ: 認可判定と付与操作の 404 応答へ変換するため
 */
package org.openreg.registrar.api;

public class ScopeNotFoundException extends RuntimeException {

  public ScopeNotFoundException(String message) {
    super(message);
  }
}
