/*
 * どこで: Registrar 設定
 * 何を: LMS (登録データ提供元) 呼び出し設定を保持する
 * なぜ: 下流 URL・パス・タイムアウトを外部化するため
 */
package org.openreg.registrar.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "registrar.lms")
public record LmsClientProperties(
    String baseUrl,
    String programEnrollmentsPath,
    Duration connectTimeout,
    Duration readTimeout,
    String accessToken) {

  public LmsClientProperties {
    baseUrl = baseUrl == null ? "http://lms:8000" : baseUrl;
    programEnrollmentsPath =
        programEnrollmentsPath == null || programEnrollmentsPath.isBlank()
            ? "/api/program_enrollments/v1/programs/{programUuid}/enrollments/"
            : programEnrollmentsPath;
    connectTimeout = connectTimeout == null ? Duration.ofSeconds(5) : connectTimeout;
    readTimeout = readTimeout == null ? Duration.ofSeconds(60) : readTimeout;
  }
}
