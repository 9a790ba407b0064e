/*
 * どこで: Registrar API
 * 何を: ジョブ状態の応答フォーマットを定義する
 * なぜ: 参照者に応じて結果参照を出し分けた状態をそのまま返すため
 */
package org.openreg.registrar.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.UUID;
import org.openreg.registrar.model.JobOperation;
import org.openreg.registrar.model.JobState;
import org.openreg.registrar.model.JobView;
import org.openreg.registrar.model.ScopeKind;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobResponse(
    UUID jobId,
    JobOperation operation,
    ScopeKind targetKind,
    long targetId,
    JobState state,
    String message,
    boolean cancelRequested,
    Instant createdAt,
    Instant updatedAt,
    String resultRef,
    String downloadUrl) {

  static JobResponse from(JobView view) {
    return new JobResponse(
        view.jobId(),
        view.operation(),
        view.target().kind(),
        view.target().id(),
        view.state(),
        view.message(),
        view.cancelRequested(),
        view.createdAt(),
        view.updatedAt(),
        view.resultRef() == null ? null : view.resultRef().value(),
        view.downloadUrl() == null ? null : view.downloadUrl().toString());
  }
}
