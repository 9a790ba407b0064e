/*
 * どこで: Common 共通設定
 * 何を: Clock を DI 可能にする
 * なぜ: ジョブ期限やタイムスタンプを同一の時刻源で扱うため
 */
package org.openreg.common.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
