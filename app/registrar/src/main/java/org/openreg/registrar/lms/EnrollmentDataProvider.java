/*
 * どこで: Registrar 下流連携
 * 何を: 登録データ提供元へのページ取得/バッチ書き込みを抽象化する
 * なぜ: ジョブ実行器を下流の HTTP 仕様から切り離してテスト可能にするため
 */
package org.openreg.registrar.lms;

import java.util.List;
import java.util.UUID;
import org.openreg.registrar.model.EnrollmentItem;

public interface EnrollmentDataProvider {

  /**
   * 役割: プログラム登録一覧の 1 ページを取得する。
   * 動作: cursor が null なら先頭ページ、そうでなければ前ページの next を辿る。
   * 例外: 通信失敗・認証失敗・5xx・不正な応答は {@link DownstreamFailureException}。
   */
  EnrollmentPage fetchProgramEnrollments(UUID programUuid, String cursor);

  /**
   * 役割: 1 バッチ分の登録を書き込む。
   * 動作: 200/201/207/422 は項目単位の結果として返し、それ以外は例外にする。
   */
  EnrollmentWriteResponse writeProgramEnrollments(
      UUID programUuid, EnrollmentWriteMode mode, List<EnrollmentItem> items);
}
