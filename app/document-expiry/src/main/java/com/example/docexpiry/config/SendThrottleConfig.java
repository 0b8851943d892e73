/*
 * どこで: Document expiry 設定
 * 何を: 送信間隔を守る SendThrottle を Bean として提供する
 * なぜ: 全バッチで同じスロットルを共有し、しきい値をまたいでも最小間隔を保つため
 */
package com.example.docexpiry.config;

import com.example.docexpiry.service.MinimumIntervalSendThrottle;
import com.example.docexpiry.service.SendThrottle;
import com.google.common.base.Ticker;
import com.google.common.util.concurrent.Uninterruptibles;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SendThrottleConfig {

  @Bean
  public SendThrottle sendThrottle(ExpiryNotificationProperties properties) {
    return new MinimumIntervalSendThrottle(
        properties.sendInterval(), Ticker.systemTicker(), Uninterruptibles::sleepUninterruptibly);
  }
}
