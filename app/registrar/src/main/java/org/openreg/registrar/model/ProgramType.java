/*
 * どこで: Registrar モデル
 * 何を: プログラム種別を表す
 * なぜ: 登録系 API を許可できる学位プログラムを判定するため
 */
package org.openreg.registrar.model;

public enum ProgramType {
  MASTERS(true),
  MICROMASTERS(false),
  MICROBACHELORS(false),
  PROFESSIONAL_CERTIFICATE(false),
  OTHER(false);

  private final boolean enrollmentEnabled;

  ProgramType(boolean enrollmentEnabled) {
    this.enrollmentEnabled = enrollmentEnabled;
  }

  public boolean isEnrollmentEnabled() {
    return enrollmentEnabled;
  }
}
