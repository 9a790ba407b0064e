package org.openreg.registrar.lms;

import com.fasterxml.jackson.annotation.JsonCreator;
import org.springframework.http.HttpMethod;

/** 書き込みジョブの種類と下流 HTTP メソッドの対応。 */
public enum EnrollmentWriteMode {
  CREATE(HttpMethod.POST),
  UPDATE(HttpMethod.PATCH),
  CREATE_OR_UPDATE(HttpMethod.PUT);

  private final HttpMethod httpMethod;

  EnrollmentWriteMode(HttpMethod httpMethod) {
    this.httpMethod = httpMethod;
  }

  public HttpMethod httpMethod() {
    return httpMethod;
  }

  @JsonCreator
  public static EnrollmentWriteMode fromValue(String value) {
    for (EnrollmentWriteMode mode : values()) {
      if (mode.name().equalsIgnoreCase(value)) {
        return mode;
      }
    }
    throw new IllegalArgumentException("unknown write mode: " + value);
  }
}
