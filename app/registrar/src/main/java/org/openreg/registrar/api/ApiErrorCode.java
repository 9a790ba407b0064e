/*
 * どこで: Registrar API
 * 何を: エラー応答のコードを定義する
 * なぜ: 同じ HTTP ステータスでも原因を区別できるようにするため
 */
package org.openreg.registrar.api;

public enum ApiErrorCode {
  BAD_REQUEST,
  INVALID_ROLE,
  NOT_FOUND,
  FORBIDDEN,
  JOB_STATE_CONFLICT,
  RESULT_NOT_READY,
  INTERNAL_ERROR
}
