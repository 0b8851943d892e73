/*
 * どこで: Document expiry モデル
 * 何を: あるしきい値で通知対象になった従業員の読み取り専用ビュー
 * なぜ: 従業員テーブル全体ではなく通知に必要な列だけを扱うため
 */
package com.example.docexpiry.model;

import java.time.LocalDate;

public record EligibleEmployee(
    String employeeId, String name, String email, String companyName, LocalDate expiryDate) {}
