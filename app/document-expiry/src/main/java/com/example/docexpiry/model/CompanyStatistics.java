/*
 * どこで: Document expiry モデル
 * 何を: company_statistics_mv の 1 行
 * なぜ: 会社別の在籍数と期限間近件数をダッシュボードへ返すため
 */
package com.example.docexpiry.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CompanyStatistics(
    String companyName,
    long totalEmployees,
    long activeEmployees,
    long inactiveEmployees,
    long visaExpiringWithin30Days,
    long visaExpiringWithin60Days,
    long passportExpiringWithin60Days,
    long labourCardExpiringWithin60Days,
    Instant lastUpdated) {}
