/*
 * どこで: Document expiry モデル
 * 何を: 定期再集計する集計スナップショット(マテリアライズドビュー)の一覧
 * なぜ: ビュー名と再集計関数の対応を一箇所に固定し、任意 SQL を受け付けないため
 */
package com.example.docexpiry.model;

import java.util.Arrays;
import java.util.Optional;

public enum AggregateView {
  COMPANY_DOCUMENT_FOLDERS("company-document-folders", "company_document_folders_mv"),
  EMPLOYEE_COUNTS_BY_COMPANY("employee-counts-by-company", "employee_counts_by_company_mv"),
  DOCUMENT_EXPIRY_MONITORING("document-expiry-monitoring", "document_expiry_monitoring_mv"),
  COMPANY_STATISTICS("company-statistics", "company_statistics_mv"),
  EMPLOYEE_DOCUMENT_SUMMARY("employee-document-summary", "employee_document_summary_mv");

  private final String slug;
  private final String viewName;

  AggregateView(String slug, String viewName) {
    this.slug = slug;
    this.viewName = viewName;
  }

  public String slug() {
    return slug;
  }

  public String viewName() {
    return viewName;
  }

  public String refreshFunction() {
    return "refresh_" + viewName;
  }

  public static Optional<AggregateView> fromSlug(String slug) {
    return Arrays.stream(values()).filter(view -> view.slug.equals(slug)).findFirst();
  }
}
