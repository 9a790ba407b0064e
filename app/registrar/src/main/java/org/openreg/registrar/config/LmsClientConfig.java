/*
 * どこで: Registrar 設定
 * 何を: LMS 呼び出し専用 RestClient を提供する
 * なぜ: baseUrl・タイムアウト・認証ヘッダを下流ごとに分離するため
 */
package org.openreg.registrar.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class LmsClientConfig {

  @Bean
  RestClient lmsRestClient(RestClient.Builder builder, LmsClientProperties properties) {
    final SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(properties.connectTimeout());
    requestFactory.setReadTimeout(properties.readTimeout());
    final RestClient.Builder configured =
        builder.baseUrl(properties.baseUrl()).requestFactory(requestFactory);
    if (properties.accessToken() != null && !properties.accessToken().isBlank()) {
      configured.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.accessToken());
    }
    return configured.build();
  }
}
