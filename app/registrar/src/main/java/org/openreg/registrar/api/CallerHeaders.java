/*
 * どこで: Registrar API
 * 何を: ゲートウェイが付与する検証済み呼び出し元ヘッダを Subject に変換する
 * なぜ: 認証はゲートウェイの責務で、ここでは資格情報を検証しないため
 */
package org.openreg.registrar.api;

import org.openreg.registrar.model.Subject;

final class CallerHeaders {

  static final String SUBJECT_ID = "X-Subject-Id";
  static final String USERNAME = "X-Subject-Username";
  static final String EMAIL = "X-Subject-Email";
  static final String ADMIN = "X-Subject-Admin";

  private CallerHeaders() {}

  static Subject toSubject(String subjectId, String username, String email, String admin) {
    return new Subject(subjectId, username, email, Boolean.parseBoolean(admin));
  }
}
