package org.openreg.registrar.lms;

import java.util.Map;

/** 書き込み 1 バッチの応答。statuses は student_key ごとの下流ステータス。 */
public record EnrollmentWriteResponse(int httpStatus, Map<String, String> statuses) {

  public EnrollmentWriteResponse {
    statuses = Map.copyOf(statuses);
  }
}
