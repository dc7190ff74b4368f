/*
 * どこで: 共通設定
 * 何を: UTC の Clock Bean を提供する
 * なぜ: 取得時刻と成果物名をテストで再現可能にするため
 */
package com.example.common.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration(proxyBeanMethods = false)
public class TimeConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
