/*
 * どこで: Registrar ジョブモデル
 * 何を: ジョブ状態と許可される遷移を定義する
 * なぜ: 遷移判定を状態自身に閉じ込めて呼び出し側の分岐を減らすため
 */
package org.openreg.registrar.model;

public enum JobState {
  PENDING,
  IN_PROGRESS,
  SUCCEEDED,
  FAILED;

  public boolean isTerminal() {
    return this == SUCCEEDED || this == FAILED;
  }

  public boolean canTransitionTo(JobState next) {
    return switch (this) {
      case PENDING -> next == IN_PROGRESS;
      case IN_PROGRESS -> next == SUCCEEDED || next == FAILED;
      case SUCCEEDED, FAILED -> false;
    };
  }
}
