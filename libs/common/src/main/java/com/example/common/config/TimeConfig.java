/*
 * どこで: Common 共通設定
 * 何を: 業務タイムゾーン付きの Clock を DI 可能にする
 * なぜ: 「今日」の判定を全コンポーネントで同じ暦に揃え、テストで固定できるようにするため
 */
package com.example.common.config;

import java.time.Clock;
import java.time.ZoneId;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  @Bean
  public Clock clock(@Value("${app.time-zone:UTC}") String timeZone) {
    // Instant.now(clock) はゾーンの影響を受けず、LocalDate.now(clock) だけが業務日付になる
    return Clock.system(ZoneId.of(timeZone));
  }
}
