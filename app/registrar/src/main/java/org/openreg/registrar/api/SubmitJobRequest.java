/*
 * どこで: Registrar API
 * 何を: ジョブ投入リクエストの入力を保持する
 * なぜ: input は操作ごとに形が異なるため JSON のまま受け取り、ハンドラで検証するため
 */
package org.openreg.registrar.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotNull;
import org.openreg.registrar.model.JobOperation;
import org.openreg.registrar.model.ScopeKind;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SubmitJobRequest(
    @NotNull(message = "operation is required") JobOperation operation,
    @NotNull(message = "target_kind is required") ScopeKind targetKind,
    @NotNull(message = "target_id is required") Long targetId,
    JsonNode input) {}
