/*
 * どこで: Registrar ジョブ実行
 * 何を: 登録の一括書き込みをバッチに分割して下流へ送り、項目単位の結果を集計する
 * なぜ: 一部項目の失敗でジョブ全体を失敗させず、全項目の結果を成果物に残すため
 */
package org.openreg.registrar.job;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.Lists;
import java.io.IOException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.openreg.registrar.config.JobProperties;
import org.openreg.registrar.lms.DownstreamFailureException;
import org.openreg.registrar.lms.EnrollmentDataProvider;
import org.openreg.registrar.lms.EnrollmentWriteResponse;
import org.openreg.registrar.model.EnrollmentItem;
import org.openreg.registrar.model.ItemOutcome;
import org.openreg.registrar.model.JobOperation;
import org.openreg.registrar.model.Program;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class WriteEnrollmentsHandler implements JobHandler {

  private static final Logger logger = LoggerFactory.getLogger(WriteEnrollmentsHandler.class);

  static final Set<String> REQUEST_STATUSES =
      Set.of("enrolled", "pending", "suspended", "canceled", "ended");
  private static final Set<String> SUCCESS_STATUSES =
      Set.of("enrolled", "pending", "suspended", "canceled", "ended", "active", "inactive");
  private static final String STATUS_DUPLICATED = "duplicated";
  private static final String STATUS_INTERNAL_ERROR = "internal-error";
  private static final String STATUS_INVALID_KEY = "invalid-student-key";
  private static final String STATUS_INVALID_STATUS = "invalid-status";

  private final EnrollmentDataProvider enrollmentDataProvider;
  private final JobProperties properties;
  private final ObjectMapper objectMapper;

  public WriteEnrollmentsHandler(
      EnrollmentDataProvider enrollmentDataProvider,
      JobProperties properties,
      ObjectMapper objectMapper) {
    this.enrollmentDataProvider = enrollmentDataProvider;
    this.properties = properties;
    this.objectMapper = objectMapper;
  }

  @Override
  public JobOperation operation() {
    return JobOperation.WRITE_ENROLLMENTS;
  }

  @Override
  public void validateInput(String inputJson) {
    if (parse(inputJson).items().isEmpty()) {
      throw new IllegalArgumentException("payload.items must not be empty");
    }
  }

  @Override
  public JobArtifact execute(JobContext context) throws IOException {
    final Program program = context.requireProgram();
    final WriteEnrollmentsInput input = parse(context.job().inputJson());
    final List<EnrollmentItem> items = input.items();
    final ItemResult[] results = new ItemResult[items.size()];
    final List<Integer> sendable = classifyLocally(items, results);

    final List<List<Integer>> batches = Lists.partition(sendable, properties.writeBatchSize());
    int completedBatches = 0;
    for (List<Integer> batch : batches) {
      context.checkpoint();
      final List<EnrollmentItem> batchItems = new ArrayList<>(batch.size());
      for (Integer index : batch) {
        batchItems.add(items.get(index));
      }
      try {
        final EnrollmentWriteResponse response =
            enrollmentDataProvider.writeProgramEnrollments(
                program.uuid(), input.mode(), batchItems);
        for (Integer index : batch) {
          final String status = response.statuses().get(items.get(index).studentKey());
          results[index] = classifyDownstream(status);
        }
      } catch (DownstreamFailureException ex) {
        if (!ex.isBatchScoped()) {
          final Map<String, Object> details = new HashMap<>();
          details.put("reason", ex.reason().name());
          details.put("completed_batches", completedBatches);
          details.put("total_batches", batches.size());
          throw new JobExecutionException(
              JobExecutionException.FailureCode.DOWNSTREAM_FAILURE, ex.getMessage(), details, ex);
        }
        // 下流がバッチ全体を拒否した場合、その項目は内部エラーとして残して次へ進む
        logger.warn(
            "lms rejected batch jobId={} batch={} items={}",
            context.job().jobId(),
            completedBatches + 1,
            batch.size(),
            ex);
        for (Integer index : batch) {
          results[index] = new ItemResult(ItemOutcome.INTERNAL_ERROR, STATUS_INTERNAL_ERROR);
        }
      }
      completedBatches++;
    }
    return writeArtifact(items, results, completedBatches);
  }

  private List<Integer> classifyLocally(List<EnrollmentItem> items, ItemResult[] results) {
    final Map<String, Integer> keyCounts = new HashMap<>();
    for (EnrollmentItem item : items) {
      if (item != null && hasText(item.studentKey())) {
        keyCounts.merge(item.studentKey(), 1, Integer::sum);
      }
    }
    final List<Integer> sendable = new ArrayList<>();
    for (int i = 0; i < items.size(); i++) {
      final EnrollmentItem item = items.get(i);
      if (item == null || !hasText(item.studentKey())) {
        results[i] = new ItemResult(ItemOutcome.VALIDATION_ERROR, STATUS_INVALID_KEY);
      } else if (keyCounts.get(item.studentKey()) > 1) {
        // 同じ学生キーが複数ある場合はどれも送らない
        results[i] = new ItemResult(ItemOutcome.DUPLICATE, STATUS_DUPLICATED);
      } else if (item.status() == null || !REQUEST_STATUSES.contains(item.status())) {
        results[i] = new ItemResult(ItemOutcome.VALIDATION_ERROR, STATUS_INVALID_STATUS);
      } else {
        results[i] = new ItemResult(ItemOutcome.INTERNAL_ERROR, STATUS_INTERNAL_ERROR);
        sendable.add(i);
      }
    }
    return sendable;
  }

  private ItemResult classifyDownstream(String status) {
    if (status == null) {
      // 応答に含まれない項目は内部エラー扱い
      return new ItemResult(ItemOutcome.INTERNAL_ERROR, STATUS_INTERNAL_ERROR);
    }
    if (SUCCESS_STATUSES.contains(status)) {
      return new ItemResult(ItemOutcome.SUCCESS, status);
    }
    if (STATUS_DUPLICATED.equals(status)) {
      return new ItemResult(ItemOutcome.DUPLICATE, status);
    }
    if (STATUS_INTERNAL_ERROR.equals(status)) {
      return new ItemResult(ItemOutcome.INTERNAL_ERROR, status);
    }
    return new ItemResult(ItemOutcome.VALIDATION_ERROR, status);
  }

  private JobArtifact writeArtifact(
      List<EnrollmentItem> items, ItemResult[] results, int completedBatches) throws IOException {
    final Map<ItemOutcome, Integer> counts = new EnumMap<>(ItemOutcome.class);
    for (ItemOutcome outcome : ItemOutcome.values()) {
      counts.put(outcome, 0);
    }
    for (ItemResult result : results) {
      counts.merge(result.outcome(), 1, Integer::sum);
    }
    final int outcomeCode = outcomeCode(counts.get(ItemOutcome.SUCCESS), items.size());
    try (ArtifactWriter writer = ArtifactWriter.open(objectMapper)) {
      final JsonGenerator json = writer.json();
      json.writeStartObject();
      json.writeNumberField("outcome_code", outcomeCode);
      json.writeObjectFieldStart("summary");
      json.writeNumberField("total", items.size());
      json.writeNumberField("batches", completedBatches);
      for (ItemOutcome outcome : ItemOutcome.values()) {
        json.writeNumberField(outcome.name().toLowerCase(), counts.get(outcome));
      }
      json.writeEndObject();
      json.writeArrayFieldStart("results");
      for (int i = 0; i < items.size(); i++) {
        final EnrollmentItem item = items.get(i);
        json.writeStartObject();
        json.writeStringField("student_key", item == null ? null : item.studentKey());
        json.writeStringField("outcome", results[i].outcome().name());
        json.writeStringField("status", results[i].status());
        json.writeEndObject();
      }
      json.writeEndArray();
      json.writeEndObject();
      final String summary =
          String.format(
              "outcome=%d total=%d success=%d duplicate=%d validation_error=%d internal_error=%d",
              outcomeCode,
              items.size(),
              counts.get(ItemOutcome.SUCCESS),
              counts.get(ItemOutcome.DUPLICATE),
              counts.get(ItemOutcome.VALIDATION_ERROR),
              counts.get(ItemOutcome.INTERNAL_ERROR));
      return writer.finish(summary);
    }
  }

  // 200: 全件成功, 207: 一部成功, 422: 成功なし
  @VisibleForTesting
  static int outcomeCode(int successCount, int total) {
    if (successCount == total && total > 0) {
      return 200;
    }
    return successCount > 0 ? 207 : 422;
  }

  private WriteEnrollmentsInput parse(String inputJson) {
    if (inputJson == null || inputJson.isBlank()) {
      throw new IllegalArgumentException("payload is required");
    }
    try {
      return objectMapper.readValue(inputJson, WriteEnrollmentsInput.class);
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("payload is invalid", ex);
    }
  }

  private boolean hasText(String value) {
    return value != null && !value.isBlank();
  }

  private record ItemResult(ItemOutcome outcome, String status) {}
}
