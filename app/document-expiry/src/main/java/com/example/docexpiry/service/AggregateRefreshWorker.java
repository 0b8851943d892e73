/*
 * Where: Document expiry aggregate worker
 * What: Refreshes each aggregate snapshot on its own fixed delay
 * Why: Keep refresh cadence in the application instead of a database-specific cron extension
 */
package com.example.docexpiry.service;

import com.example.docexpiry.config.AggregateRefreshProperties;
import com.example.docexpiry.model.AggregateView;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "docexpiry.aggregate.enabled", havingValue = "true")
public class AggregateRefreshWorker {

  private static final Logger logger = LoggerFactory.getLogger(AggregateRefreshWorker.class);

  private final AggregateRefreshService refreshService;
  private final AggregateRefreshProperties properties;

  @PostConstruct
  void logSchedule() {
    for (AggregateView view : AggregateView.values()) {
      logger.info(
          "aggregate refresh scheduled view={} interval={}",
          view.viewName(),
          properties.intervalFor(view));
    }
  }

  @Scheduled(
      initialDelayString = "${docexpiry.aggregate.initial-delay}",
      fixedDelayString = "${docexpiry.aggregate.company-document-folders-interval}")
  public void refreshCompanyDocumentFolders() {
    refreshService.refresh(AggregateView.COMPANY_DOCUMENT_FOLDERS);
  }

  @Scheduled(
      initialDelayString = "${docexpiry.aggregate.initial-delay}",
      fixedDelayString = "${docexpiry.aggregate.employee-counts-by-company-interval}")
  public void refreshEmployeeCountsByCompany() {
    refreshService.refresh(AggregateView.EMPLOYEE_COUNTS_BY_COMPANY);
  }

  @Scheduled(
      initialDelayString = "${docexpiry.aggregate.initial-delay}",
      fixedDelayString = "${docexpiry.aggregate.document-expiry-monitoring-interval}")
  public void refreshDocumentExpiryMonitoring() {
    refreshService.refresh(AggregateView.DOCUMENT_EXPIRY_MONITORING);
  }

  @Scheduled(
      initialDelayString = "${docexpiry.aggregate.initial-delay}",
      fixedDelayString = "${docexpiry.aggregate.company-statistics-interval}")
  public void refreshCompanyStatistics() {
    refreshService.refresh(AggregateView.COMPANY_STATISTICS);
  }

  @Scheduled(
      initialDelayString = "${docexpiry.aggregate.initial-delay}",
      fixedDelayString = "${docexpiry.aggregate.employee-document-summary-interval}")
  public void refreshEmployeeDocumentSummary() {
    refreshService.refresh(AggregateView.EMPLOYEE_DOCUMENT_SUMMARY);
  }
}
