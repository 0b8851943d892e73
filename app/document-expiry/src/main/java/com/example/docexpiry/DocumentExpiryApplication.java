/*
 * どこで: Document expiry アプリのエントリポイント
 * 何を: Spring Boot の起動と設定スキャン/スケジューリングを有効化する
 * なぜ: 通知サイクル/集計再集計/保持期間削除のワーカーを 1 プロセスで動かすため
 */
package com.example.docexpiry;

import com.example.common.config.TimeConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Import;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
@Import(TimeConfig.class)
public class DocumentExpiryApplication {

  public static void main(String[] args) {
    SpringApplication.run(DocumentExpiryApplication.class, args);
  }
}
