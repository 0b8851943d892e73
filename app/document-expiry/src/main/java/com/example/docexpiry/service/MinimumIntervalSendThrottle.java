/*
 * どこで: Document expiry サービス層
 * 何を: 直前の許可から一定間隔が空くまで待たせるスロットル
 * なぜ: アイドル後にまとめて許可を払い出さず、常に最小間隔を守るため
 */
package com.example.docexpiry.service;

import com.google.common.base.Preconditions;
import com.google.common.base.Ticker;
import java.time.Duration;

public class MinimumIntervalSendThrottle implements SendThrottle {

  /** テストで実時間を待たないための差し替え口。 */
  @FunctionalInterface
  public interface Sleeper {
    void sleep(Duration duration);
  }

  private final long intervalNanos;
  private final Ticker ticker;
  private final Sleeper sleeper;

  private boolean issued;
  private long lastPermitNanos;

  public MinimumIntervalSendThrottle(Duration interval, Ticker ticker, Sleeper sleeper) {
    Preconditions.checkArgument(!interval.isNegative(), "interval must not be negative");
    this.intervalNanos = interval.toNanos();
    this.ticker = ticker;
    this.sleeper = sleeper;
  }

  @Override
  public synchronized Duration acquire() {
    final long now = ticker.read();
    if (!issued) {
      issued = true;
      lastPermitNanos = now;
      return Duration.ZERO;
    }
    final long earliest = lastPermitNanos + intervalNanos;
    final long waitNanos = Math.max(0L, earliest - now);
    if (waitNanos > 0) {
      sleeper.sleep(Duration.ofNanos(waitNanos));
    }
    lastPermitNanos = Math.max(ticker.read(), earliest);
    return Duration.ofNanos(waitNanos);
  }
}
