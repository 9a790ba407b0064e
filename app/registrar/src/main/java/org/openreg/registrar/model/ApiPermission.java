/*
 * どこで: Registrar モデル
 * 何を: 外部に公開する API 権限の語彙を定義する
 * なぜ: 内部権限の粒度を境界の外へ出さないため
 */
package org.openreg.registrar.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ApiPermission {
  READ_METADATA("read_metadata"),
  READ_ENROLLMENTS("read_enrollments"),
  WRITE_ENROLLMENTS("write_enrollments"),
  READ_REPORTS("read_reports");

  private final String value;

  ApiPermission(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  public boolean isEnrollmentPermission() {
    return this == READ_ENROLLMENTS || this == WRITE_ENROLLMENTS;
  }

  @JsonCreator
  public static ApiPermission fromValue(String value) {
    for (ApiPermission permission : values()) {
      if (permission.value.equals(value) || permission.name().equals(value)) {
        return permission;
      }
    }
    throw new IllegalArgumentException("unknown action: " + value);
  }
}
