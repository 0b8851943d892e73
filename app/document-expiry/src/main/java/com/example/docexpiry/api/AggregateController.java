/*
 * どこで: Document expiry API
 * 何を: 集計スナップショットの手動再集計と読み取りを提供する
 * なぜ: 定期実行を待たずに再集計し、ビュー単位の成否を確認できるようにするため
 */
package com.example.docexpiry.api;

import com.example.docexpiry.model.AggregateView;
import com.example.docexpiry.model.CompanyStatistics;
import com.example.docexpiry.model.DocumentType;
import com.example.docexpiry.model.ExpiringDocument;
import com.example.docexpiry.model.RefreshOutcome;
import com.example.docexpiry.repository.AggregateViewRepository;
import com.example.docexpiry.service.AggregateRefreshService;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/aggregates")
@RequiredArgsConstructor
public class AggregateController {

  static final int MAX_WITHIN_DAYS = 365;

  private final AggregateRefreshService refreshService;
  private final AggregateViewRepository aggregateViewRepository;

  @PostMapping("/refresh")
  public List<RefreshOutcome> refreshAll() {
    return refreshService.refreshAll();
  }

  @PostMapping("/{view}/refresh")
  public RefreshOutcome refresh(@PathVariable("view") String view) {
    final AggregateView aggregateView =
        AggregateView.fromSlug(view)
            .orElseThrow(() -> new InvalidRequestException("unknown aggregate view: " + view));
    return refreshService.refresh(aggregateView);
  }

  @GetMapping("/company-statistics")
  public List<CompanyStatistics> companyStatistics() {
    return aggregateViewRepository.findCompanyStatistics();
  }

  @GetMapping("/expiring-documents")
  public List<ExpiringDocument> expiringDocuments(
      @RequestParam(name = "document_type", defaultValue = "VISA") DocumentType documentType,
      @RequestParam(name = "within_days", defaultValue = "30") int withinDays) {
    if (withinDays < 0 || withinDays > MAX_WITHIN_DAYS) {
      throw new InvalidRequestException("within_days must be between 0 and " + MAX_WITHIN_DAYS);
    }
    return aggregateViewRepository.findExpiringDocuments(documentType, withinDays);
  }
}
