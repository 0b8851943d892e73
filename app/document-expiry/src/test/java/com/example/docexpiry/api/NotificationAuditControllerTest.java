package com.example.docexpiry.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.docexpiry.model.DocumentType;
import com.example.docexpiry.model.FailureKind;
import com.example.docexpiry.model.NotificationCategory;
import com.example.docexpiry.model.NotificationQuery;
import com.example.docexpiry.model.NotificationRecord;
import com.example.docexpiry.model.NotificationSeverity;
import com.example.docexpiry.model.NotificationStatus;
import com.example.docexpiry.repository.NotificationAuditStore;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(NotificationAuditController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import(ApiExceptionHandler.class)
class NotificationAuditControllerTest {

  @Autowired private MockMvc mockMvc;

  @MockitoBean private NotificationAuditStore auditStore;

  @Test
  void listsNotificationsWithFilters() throws Exception {
    final UUID id = UUID.fromString("00000000-0000-0000-0000-000000000001");
    when(auditStore.find(any()))
        .thenReturn(
            List.of(
                new NotificationRecord(
                    id,
                    "[CRITICAL] Visa expiry: Ali - 7 days remaining",
                    "text",
                    NotificationSeverity.ERROR,
                    "ali@example.com",
                    NotificationCategory.VISA,
                    NotificationStatus.FAILED,
                    "E1",
                    DocumentType.VISA,
                    7,
                    LocalDate.of(2026, 3, 8),
                    FailureKind.PERMANENT,
                    Instant.parse("2026-03-01T04:00:00Z"),
                    null,
                    "550 user unknown")));

    mockMvc
        .perform(
            get("/notifications")
                .param("status", "FAILED")
                .param("category", "VISA")
                .param("from", "2026-02-01T00:00:00Z")
                .param("to", "2026-03-02T00:00:00Z")
                .param("limit", "20")
                .param("offset", "40"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.limit").value(20))
        .andExpect(jsonPath("$.offset").value(40))
        .andExpect(jsonPath("$.notifications[0].notification_id").value(id.toString()))
        .andExpect(jsonPath("$.notifications[0].failure_kind").value("PERMANENT"))
        .andExpect(jsonPath("$.notifications[0].threshold_days").value(7))
        .andExpect(jsonPath("$.notifications[0].expiry_date").value("2026-03-08"));

    final ArgumentCaptor<NotificationQuery> captor =
        ArgumentCaptor.forClass(NotificationQuery.class);
    verify(auditStore).find(captor.capture());
    assertThat(captor.getValue())
        .isEqualTo(
            new NotificationQuery(
                NotificationStatus.FAILED,
                NotificationCategory.VISA,
                Instant.parse("2026-02-01T00:00:00Z"),
                Instant.parse("2026-03-02T00:00:00Z"),
                20,
                40));
  }

  @Test
  void defaultsToFirstPage() throws Exception {
    when(auditStore.find(any())).thenReturn(List.of());

    mockMvc
        .perform(get("/notifications"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.limit").value(50))
        .andExpect(jsonPath("$.notifications").isEmpty());
  }

  @Test
  void rejectsOutOfRangeLimit() throws Exception {
    mockMvc
        .perform(get("/notifications").param("limit", "500"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("DOCEXPIRY_BAD_REQUEST"));
    verifyNoInteractions(auditStore);
  }

  @Test
  void rejectsInvertedRange() throws Exception {
    mockMvc
        .perform(
            get("/notifications")
                .param("from", "2026-03-02T00:00:00Z")
                .param("to", "2026-03-01T00:00:00Z"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("from must be before to"));
  }

  @Test
  void rejectsUnknownStatus() throws Exception {
    mockMvc
        .perform(get("/notifications").param("status", "BOUNCED"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("invalid value for parameter status"));
  }
}
