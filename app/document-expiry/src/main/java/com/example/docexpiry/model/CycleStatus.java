package com.example.docexpiry.model;

public enum CycleStatus {
  COMPLETED,
  // 全体期限に達し、残りのしきい値を次回へ回した
  TIMED_OUT,
  // 別サイクルが実行中のため開始しなかった
  REJECTED
}
