/*
 * どこで: Registrar ジョブ実行
 * 何を: プログラム登録一覧を下流からページ単位で取得し成果物へ書き出す
 * なぜ: 大量の登録データを要求処理から切り離して返すため
 */
package org.openreg.registrar.job;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.openreg.registrar.lms.DownstreamFailureException;
import org.openreg.registrar.lms.EnrollmentDataProvider;
import org.openreg.registrar.model.JobOperation;
import org.openreg.registrar.model.Program;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ReadEnrollmentsHandler implements JobHandler {

  private final EnrollmentDataProvider enrollmentDataProvider;
  private final ObjectMapper objectMapper;

  @Override
  public JobOperation operation() {
    return JobOperation.READ_ENROLLMENTS;
  }

  @Override
  public JobArtifact execute(JobContext context) throws IOException {
    final Program program = context.requireProgram();
    try (ArtifactWriter writer = ArtifactWriter.open(objectMapper)) {
      final JsonGenerator json = writer.json();
      json.writeStartObject();
      json.writeStringField("program_key", program.key());
      json.writeStringField("program_uuid", program.uuid().toString());
      json.writeArrayFieldStart("enrollments");
      final int count =
          EnrollmentPages.forEachRow(
              context, enrollmentDataProvider, program.uuid(), json::writeTree);
      json.writeEndArray();
      json.writeNumberField("count", count);
      json.writeEndObject();
      return writer.finish("enrollments=" + count);
    } catch (DownstreamFailureException ex) {
      throw new JobExecutionException(
          JobExecutionException.FailureCode.DOWNSTREAM_FAILURE,
          ex.getMessage(),
          Map.of("reason", ex.reason().name()),
          ex);
    }
  }
}
