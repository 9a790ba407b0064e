/*
 * どこで: Registrar ジョブ実行
 * 何を: 下流の登録一覧を next カーソルに従って最後のページまで辿る
 * なぜ: 読み出しジョブとレポートジョブで同じ打ち切り条件を共有するため
 */
package org.openreg.registrar.job;

import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.util.HashSet;
import java.util.Set;
import java.util.UUID;
import org.openreg.registrar.lms.DownstreamFailureException;
import org.openreg.registrar.lms.EnrollmentDataProvider;
import org.openreg.registrar.lms.EnrollmentPage;

final class EnrollmentPages {

  @FunctionalInterface
  interface RowConsumer {
    void accept(JsonNode row) throws IOException;
  }

  private EnrollmentPages() {}

  /**
   * 各ページの取得前にチェックポイントを通し、行を順に渡す。
   * 同じカーソルが二度返された場合は INVALID_RESPONSE の DownstreamFailureException。
   *
   * @return 渡した行数
   */
  static int forEachRow(
      JobContext context,
      EnrollmentDataProvider provider,
      UUID programUuid,
      RowConsumer consumer)
      throws IOException {
    final Set<String> seenCursors = new HashSet<>();
    String cursor = null;
    int count = 0;
    do {
      context.checkpoint();
      final EnrollmentPage page = provider.fetchProgramEnrollments(programUuid, cursor);
      for (JsonNode row : page.results()) {
        consumer.accept(row);
        count++;
      }
      cursor = page.hasNext() ? page.next() : null;
      if (cursor != null && !seenCursors.add(cursor)) {
        throw new DownstreamFailureException(
            DownstreamFailureException.Reason.INVALID_RESPONSE,
            "lms pagination cursor repeated: " + cursor);
      }
    } while (cursor != null);
    return count;
  }
}
