package org.openreg.registrar.job;

import java.util.List;
import org.openreg.registrar.lms.EnrollmentWriteMode;
import org.openreg.registrar.model.EnrollmentItem;

/** WRITE_ENROLLMENTS ジョブの入力ペイロード。 */
public record WriteEnrollmentsInput(EnrollmentWriteMode mode, List<EnrollmentItem> items) {

  public WriteEnrollmentsInput {
    mode = mode == null ? EnrollmentWriteMode.CREATE : mode;
    items = items == null ? List.of() : List.copyOf(items);
  }
}
