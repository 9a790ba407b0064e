package org.openreg.registrar.lms;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

/** 登録一覧の 1 ページ。next が null なら最終ページ。 */
public record EnrollmentPage(List<JsonNode> results, String next) {

  public EnrollmentPage {
    results = List.copyOf(results);
  }

  public boolean hasNext() {
    return next != null && !next.isBlank();
  }
}
