/*
 * どこで: Common 共通設定
 * 何を: Clock を DI 可能にする
 * なぜ: 監査ログの時刻とテストの固定時刻を同じ経路で注入するため
 */
package com.insurancecost.common.config;

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
