/*
 * どこで: Registrar ジョブ実行
 * 何を: 対象スコープのプログラムごとに登録状況を集計したレポートを生成する
 * なぜ: 組織単位の状況確認を登録データ全件の取得なしで提供するため
 */
package org.openreg.registrar.job;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import lombok.RequiredArgsConstructor;
import org.openreg.registrar.lms.DownstreamFailureException;
import org.openreg.registrar.lms.EnrollmentDataProvider;
import org.openreg.registrar.model.JobOperation;
import org.openreg.registrar.model.Program;
import org.openreg.registrar.model.ScopeKind;
import org.openreg.registrar.repository.EntityGraphRepository;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class EnrollmentReportHandler implements JobHandler {

  private static final String UNKNOWN_STATUS = "unknown";

  private final EnrollmentDataProvider enrollmentDataProvider;
  private final EntityGraphRepository entityGraphRepository;
  private final ObjectMapper objectMapper;

  @Override
  public JobOperation operation() {
    return JobOperation.GENERATE_REPORT;
  }

  @Override
  public JobArtifact execute(JobContext context) throws IOException {
    final List<Program> programs =
        context.job().target().kind() == ScopeKind.PROGRAM
            ? List.of(context.requireProgram())
            : entityGraphRepository.findProgramsAuthoredBy(List.of(context.job().target().id()));
    int total = 0;
    try (ArtifactWriter writer = ArtifactWriter.open(objectMapper)) {
      final JsonGenerator json = writer.json();
      json.writeStartObject();
      json.writeStringField("target", context.job().target().toString());
      json.writeStringField("generated_at", context.now().toString());
      json.writeArrayFieldStart("programs");
      for (Program program : programs) {
        total += writeProgram(context, program, json);
      }
      json.writeEndArray();
      json.writeNumberField("total_enrollments", total);
      json.writeEndObject();
      return writer.finish("programs=" + programs.size() + " enrollments=" + total);
    } catch (DownstreamFailureException ex) {
      throw new JobExecutionException(
          JobExecutionException.FailureCode.DOWNSTREAM_FAILURE,
          ex.getMessage(),
          Map.of("reason", ex.reason().name()),
          ex);
    }
  }

  private int writeProgram(JobContext context, Program program, JsonGenerator json)
      throws IOException {
    final Map<String, Integer> byStatus = new TreeMap<>();
    final int count =
        program.isEnrollmentEnabled()
            ? EnrollmentPages.forEachRow(
                context,
                enrollmentDataProvider,
                program.uuid(),
                row -> byStatus.merge(row.path("status").asText(UNKNOWN_STATUS), 1, Integer::sum))
            : 0;
    json.writeStartObject();
    json.writeStringField("program_key", program.key());
    json.writeStringField("program_uuid", program.uuid().toString());
    json.writeStringField("program_type", program.programType().name());
    json.writeBooleanField("enrollment_enabled", program.isEnrollmentEnabled());
    json.writeNumberField("total", count);
    json.writeObjectFieldStart("by_status");
    for (Map.Entry<String, Integer> entry : byStatus.entrySet()) {
      json.writeNumberField(entry.getKey(), entry.getValue());
    }
    json.writeEndObject();
    json.writeEndObject();
    return count;
  }
}
