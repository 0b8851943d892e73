/*
 * どこで: Document expiry サービス層
 * 何を: 連続する送信の間隔を制御する
 * なぜ: メールプロバイダのレート制限(秒間/日次の上限)を超えないため
 */
package com.example.docexpiry.service;

import java.time.Duration;

public interface SendThrottle {

  /**
   * 次の送信が許可されるまで待つ。
   *
   * @return 実際に待った時間
   */
  Duration acquire();
}
