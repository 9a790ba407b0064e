/*
 * どこで: Registrar ジョブ実行
 * 何を: 操作種別ごとの処理本体を定義する
 * なぜ: 実行器の状態管理と各操作のデータ処理を分離するため
 */
package org.openreg.registrar.job;

import java.io.IOException;
import org.openreg.registrar.model.JobOperation;

public interface JobHandler {

  JobOperation operation();

  /**
   * 役割: 投入時に入力ペイロードを検証する。
   * 例外: 不正な入力は IllegalArgumentException (投入リクエストの 400 になる)。
   */
  default void validateInput(String inputJson) {}

  /**
   * 役割: 操作を実行し、成果物を一時ファイルとして返す。
   * 動作: ページ/バッチの合間に {@link JobContext#checkpoint()} を呼び、中止要求と期限を確認する。
   * 例外: ジョブを FAILED にすべき失敗は {@link JobExecutionException}。
   */
  JobArtifact execute(JobContext context) throws IOException;
}
