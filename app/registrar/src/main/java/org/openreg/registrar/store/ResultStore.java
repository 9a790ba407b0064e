/*
 * どこで: Registrar 成果物保存
 * 何を: ジョブ成果物の保存/取得の抽象を定義する
 * なぜ: ジョブ登録簿と実行器を保存先 (ローカル or オブジェクトストレージ) から切り離すため
 */
package org.openreg.registrar.store;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.net.URI;
import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import org.openreg.registrar.model.ResultRef;

public interface ResultStore {

  /**
   * 役割: ジョブ成果物を保存する。
   * 動作: 同じ jobId へ再保存した場合は上書きする。読み手は書き込み途中の内容を観測しない。
   * 前提: length は payload の正確なバイト数。
   */
  ResultRef put(UUID jobId, InputStream payload, long length, String contentType);

  default ResultRef put(UUID jobId, byte[] payload, String contentType) {
    return put(jobId, new ByteArrayInputStream(payload), payload.length, contentType);
  }

  StoredResult get(ResultRef ref);

  /** 存在しない参照の削除は何もしない。 */
  void delete(ResultRef ref);

  /** 直接ダウンロード用の期限付き URL。提供できない実装は空を返す。 */
  Optional<URI> downloadUrl(ResultRef ref, Duration ttl);

  static String objectKey(UUID jobId, String contentType) {
    return "job-results/" + jobId + "." + extension(contentType);
  }

  static String extension(String contentType) {
    if (contentType == null) {
      return "bin";
    }
    final String base = contentType.split(";", 2)[0].trim().toLowerCase();
    return switch (base) {
      case "application/json" -> "json";
      case "text/csv" -> "csv";
      case "text/plain" -> "txt";
      default -> "bin";
    };
  }
}
