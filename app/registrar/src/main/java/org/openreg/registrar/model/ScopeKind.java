package org.openreg.registrar.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum ScopeKind {
  ORGANIZATION,
  PROGRAM;

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static ScopeKind fromValue(String value) {
    for (ScopeKind kind : values()) {
      if (kind.name().equalsIgnoreCase(value)) {
        return kind;
      }
    }
    throw new IllegalArgumentException("unknown scope_kind: " + value);
  }
}
