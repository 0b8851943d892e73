package com.example.docexpiry.model;

public enum DispatchErrorKind {
  TRANSIENT_SEND,
  PERMANENT_SEND,
  PERSISTENCE,
  // 永続化障害やタイムアウトでバッチを打ち切り、未処理のまま残した
  NOT_ATTEMPTED
}
