/*
 * Where: Document expiry application configuration binding
 * What: Holds per-view refresh intervals for the aggregate snapshots
 * Why: Fast-changing counts and heavy statistics need different cadences per environment
 */
package com.example.docexpiry.config;

import com.example.docexpiry.model.AggregateView;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "docexpiry.aggregate")
@Validated
public record AggregateRefreshProperties(
    boolean enabled,
    @NotNull Duration initialDelay,
    @NotNull Duration companyDocumentFoldersInterval,
    @NotNull Duration employeeCountsByCompanyInterval,
    @NotNull Duration documentExpiryMonitoringInterval,
    @NotNull Duration companyStatisticsInterval,
    @NotNull Duration employeeDocumentSummaryInterval) {

  public Duration intervalFor(AggregateView view) {
    return switch (view) {
      case COMPANY_DOCUMENT_FOLDERS -> companyDocumentFoldersInterval;
      case EMPLOYEE_COUNTS_BY_COMPANY -> employeeCountsByCompanyInterval;
      case DOCUMENT_EXPIRY_MONITORING -> documentExpiryMonitoringInterval;
      case COMPANY_STATISTICS -> companyStatisticsInterval;
      case EMPLOYEE_DOCUMENT_SUMMARY -> employeeDocumentSummaryInterval;
    };
  }
}
