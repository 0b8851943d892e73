/*
 * どこで: Document expiry API
 * 何を: クエリ/パスの妥当性エラーを表現する
 * なぜ: 未知のビュー名や範囲外の件数指定を 400 へ正規化するため
 */
package com.example.docexpiry.api;

public class InvalidRequestException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public InvalidRequestException(String message) {
    super(message);
  }
}
