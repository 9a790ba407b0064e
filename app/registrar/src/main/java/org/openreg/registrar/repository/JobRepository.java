/*
 * どこで: Registrar データアクセス
 * 何を: ジョブ行の登録/参照/状態 CAS を抽象化する
 * なぜ: 実行器とメンテナンスワーカーの同時確定を行レベルで排他するため
 */
package org.openreg.registrar.repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.openreg.registrar.model.JobRecord;
import org.openreg.registrar.model.JobState;

public interface JobRepository {

  void insert(JobRecord job);

  Optional<JobRecord> findById(UUID jobId);

  /**
   * 役割: 状態を expected から next.state() へ切り替える。
   * 動作: 現在状態が expected の場合に限り、next の結果参照/メッセージ/時刻も合わせて書き込む。
   * 戻り値: 更新できた場合 true。競合や状態不一致では false で行は変更しない。
   */
  boolean compareAndSetState(JobState expected, JobRecord next);

  /** 未完了ジョブに中止要求フラグを立てる。終端状態なら false。 */
  boolean requestCancel(UUID jobId, Instant requestedAt);

  boolean isCancelRequested(UUID jobId);

  /** 所有者のジョブを新しい順に返す。 */
  List<JobRecord> findByOwner(String ownerSubjectId, int limit);

  List<JobRecord> findPendingCreatedBefore(Instant threshold, int limit);

  List<JobRecord> findInProgressStartedBefore(Instant threshold, int limit);
}
