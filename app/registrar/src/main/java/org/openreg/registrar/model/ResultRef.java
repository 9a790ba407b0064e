package org.openreg.registrar.model;

/** Result Store 内の成果物を指す不透明な参照。 */
public record ResultRef(String value) {

  public ResultRef {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("result reference is required");
    }
  }

  public static ResultRef ofNullable(String value) {
    return value == null ? null : new ResultRef(value);
  }

  @Override
  public String toString() {
    return value;
  }
}
