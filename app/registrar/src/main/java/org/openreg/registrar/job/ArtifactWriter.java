/*
 * どこで: Registrar ジョブ実行
 * 何を: 成果物 JSON を一時ファイルへ逐次書き出す
 * なぜ: ページ単位で取得したデータを全件メモリに載せずに成果物化するため
 */
package org.openreg.registrar.job;

import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class ArtifactWriter implements Closeable {

  private static final Logger logger = LoggerFactory.getLogger(ArtifactWriter.class);
  static final String CONTENT_TYPE_JSON = "application/json";

  private final Path file;
  private final JsonGenerator generator;
  private boolean finished;

  private ArtifactWriter(Path file, JsonGenerator generator) {
    this.file = file;
    this.generator = generator;
  }

  static ArtifactWriter open(ObjectMapper objectMapper) throws IOException {
    final Path file = Files.createTempFile("registrar-job-", ".json");
    final JsonGenerator generator =
        objectMapper.getFactory().createGenerator(file.toFile(), JsonEncoding.UTF8);
    return new ArtifactWriter(file, generator);
  }

  JsonGenerator json() {
    return generator;
  }

  JobArtifact finish(String summary) throws IOException {
    generator.close();
    finished = true;
    return new JobArtifact(file, CONTENT_TYPE_JSON, summary);
  }

  @Override
  public void close() {
    if (finished) {
      return;
    }
    // 途中で失敗した成果物は残さない
    try {
      generator.close();
      Files.deleteIfExists(file);
    } catch (IOException ex) {
      logger.warn("failed to discard partial artifact path={}", file, ex);
    }
  }
}
