package com.example.docexpiry.support;

import com.example.docexpiry.model.DedupKey;
import com.example.docexpiry.model.DocumentType;
import com.example.docexpiry.model.EligibleEmployee;
import com.example.docexpiry.model.FailureKind;
import com.example.docexpiry.model.NotificationCategory;
import com.example.docexpiry.model.NotificationQuery;
import com.example.docexpiry.model.NotificationRecord;
import com.example.docexpiry.model.NotificationStats;
import com.example.docexpiry.model.NotificationStatus;
import com.example.docexpiry.repository.DedupFlagStore;
import com.example.docexpiry.repository.NotificationAuditStore;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;
import org.springframework.dao.DataAccessResourceFailureException;

/**
 * sent_notifications と notifications の SQL と同じ規則で動くインメモリ実装。
 * サイクル全体のシナリオを DB なしで検証するために使う。
 */
public class InMemoryExpiryStore implements DedupFlagStore, NotificationAuditStore {

  public record Employee(
      String employeeId,
      String name,
      String email,
      String companyName,
      boolean active,
      Map<DocumentType, LocalDate> expiryDates) {}

  private record SentEntry(
      String status, String claimedBy, Instant leaseUntil, UUID notificationId, Instant sentAt) {}

  private final List<Employee> employees = new ArrayList<>();
  private final Map<DedupKey, SentEntry> sentNotifications = new LinkedHashMap<>();
  private final Map<UUID, NotificationRecord> notifications = new LinkedHashMap<>();
  private int createCalls;
  private int failCreateAfter = -1;

  public synchronized InMemoryExpiryStore addEmployee(
      String employeeId, String email, DocumentType documentType, LocalDate expiryDate) {
    final Map<DocumentType, LocalDate> dates = new EnumMap<>(DocumentType.class);
    dates.put(documentType, expiryDate);
    employees.add(
        new Employee(employeeId, "Employee " + employeeId, email, "Acme Trading", true, dates));
    return this;
  }

  public synchronized InMemoryExpiryStore addEmployee(Employee employee) {
    employees.add(employee);
    return this;
  }

  /** 既に送信済みの従業員を表す。 */
  public synchronized void preMarkSent(DedupKey key, Instant sentAt) {
    sentNotifications.put(key, new SentEntry("SENT", "seed", null, UUID.randomUUID(), sentAt));
  }

  /** create が指定回数成功した後は永続層障害を投げる。 */
  public synchronized void failAuditCreateAfter(int successfulCreates) {
    this.failCreateAfter = successfulCreates;
  }

  public synchronized void recover() {
    this.failCreateAfter = -1;
  }

  public synchronized boolean isSent(DedupKey key) {
    final SentEntry entry = sentNotifications.get(key);
    return entry != null && "SENT".equals(entry.status());
  }

  public synchronized boolean hasEntry(DedupKey key) {
    return sentNotifications.containsKey(key);
  }

  public synchronized List<NotificationRecord> notifications() {
    return List.copyOf(notifications.values());
  }

  public synchronized List<NotificationRecord> notificationsFor(String employeeId) {
    return notifications.values().stream()
        .filter(record -> employeeId.equals(record.employeeId()))
        .toList();
  }

  @Override
  public synchronized List<EligibleEmployee> findEligible(
      DocumentType documentType, int thresholdDays, LocalDate today, Instant now) {
    final LocalDate target = today.plusDays(thresholdDays);
    return employees.stream()
        .filter(Employee::active)
        .filter(employee -> target.equals(employee.expiryDates().get(documentType)))
        .filter(
            employee -> {
              final SentEntry entry =
                  sentNotifications.get(
                      new DedupKey(employee.employeeId(), documentType, thresholdDays));
              return entry == null
                  || (!"SENT".equals(entry.status()) && !entry.leaseUntil().isAfter(now));
            })
        .filter(
            employee ->
                notifications.values().stream()
                    .noneMatch(
                        record ->
                            employee.employeeId().equals(record.employeeId())
                                && record.documentType() == documentType
                                && Objects.equals(record.thresholdDays(), thresholdDays)
                                && target.equals(record.expiryDate())
                                && record.status() == NotificationStatus.FAILED
                                && record.failureKind() == FailureKind.PERMANENT))
        .sorted(Comparator.comparing(Employee::employeeId))
        .map(
            employee ->
                new EligibleEmployee(
                    employee.employeeId(),
                    employee.name(),
                    employee.email(),
                    employee.companyName(),
                    target))
        .toList();
  }

  @Override
  public synchronized boolean claim(
      DedupKey key, LocalDate expiryDate, String claimedBy, Instant now, Instant leaseUntil) {
    final SentEntry existing = sentNotifications.get(key);
    if (existing != null
        && ("SENT".equals(existing.status()) || existing.leaseUntil().isAfter(now))) {
      return false;
    }
    sentNotifications.put(key, new SentEntry("CLAIMED", claimedBy, leaseUntil, null, null));
    return true;
  }

  @Override
  public synchronized boolean markSent(
      DedupKey key, UUID notificationId, Instant sentAt, String claimedBy) {
    final SentEntry existing = sentNotifications.get(key);
    if (existing == null
        || !"CLAIMED".equals(existing.status())
        || !claimedBy.equals(existing.claimedBy())) {
      return false;
    }
    sentNotifications.put(key, new SentEntry("SENT", claimedBy, null, notificationId, sentAt));
    return true;
  }

  @Override
  public synchronized void release(DedupKey key, String claimedBy) {
    final SentEntry existing = sentNotifications.get(key);
    if (existing != null
        && "CLAIMED".equals(existing.status())
        && claimedBy.equals(existing.claimedBy())) {
      sentNotifications.remove(key);
    }
  }

  @Override
  public synchronized UUID create(NotificationRecord record) {
    if (failCreateAfter >= 0 && createCalls >= failCreateAfter) {
      throw new DataAccessResourceFailureException("injected: store unreachable");
    }
    createCalls++;
    notifications.put(record.notificationId(), record);
    return record.notificationId();
  }

  @Override
  public synchronized int markSent(UUID notificationId, Instant sentAt) {
    return transition(notificationId, NotificationStatus.SENT, sentAt, null, null);
  }

  @Override
  public synchronized int markFailed(
      UUID notificationId, String errorMessage, FailureKind failureKind) {
    return transition(notificationId, NotificationStatus.FAILED, null, errorMessage, failureKind);
  }

  private int transition(
      UUID notificationId,
      NotificationStatus status,
      Instant sentAt,
      String errorMessage,
      FailureKind failureKind) {
    final NotificationRecord current = notifications.get(notificationId);
    if (current == null || current.status() != NotificationStatus.PENDING) {
      return 0;
    }
    notifications.put(
        notificationId,
        new NotificationRecord(
            current.notificationId(),
            current.title(),
            current.message(),
            current.severity(),
            current.recipient(),
            current.category(),
            status,
            current.employeeId(),
            current.documentType(),
            current.thresholdDays(),
            current.expiryDate(),
            failureKind,
            current.createdAt(),
            sentAt,
            errorMessage));
    return 1;
  }

  @Override
  public synchronized NotificationStats stats(Instant todayStart, Instant weekStart) {
    final List<NotificationRecord> all = List.copyOf(notifications.values());
    final Map<NotificationCategory, Long> byCategory =
        all.stream()
            .collect(
                Collectors.groupingBy(
                    NotificationRecord::category,
                    () -> new EnumMap<>(NotificationCategory.class),
                    Collectors.counting()));
    return new NotificationStats(
        all.size(),
        count(all, NotificationStatus.PENDING),
        count(all, NotificationStatus.SENT),
        count(all, NotificationStatus.FAILED),
        all.stream().filter(record -> !record.createdAt().isBefore(todayStart)).count(),
        all.stream().filter(record -> !record.createdAt().isBefore(weekStart)).count(),
        byCategory);
  }

  private static long count(List<NotificationRecord> records, NotificationStatus status) {
    return records.stream().filter(record -> record.status() == status).count();
  }

  @Override
  public synchronized List<NotificationRecord> find(NotificationQuery query) {
    return notifications.values().stream()
        .filter(record -> query.status() == null || record.status() == query.status())
        .filter(record -> query.category() == null || record.category() == query.category())
        .sorted(Comparator.comparing(NotificationRecord::createdAt).reversed())
        .skip(query.offset())
        .limit(query.limit())
        .toList();
  }

  @Override
  public synchronized int deleteSentOrFailedOlderThan(Instant threshold) {
    final List<UUID> expired =
        notifications.values().stream()
            .filter(record -> record.status() != NotificationStatus.PENDING)
            .filter(record -> record.createdAt().isBefore(threshold))
            .map(NotificationRecord::notificationId)
            .toList();
    expired.forEach(notifications::remove);
    return expired.size();
  }

  @Override
  public synchronized int countStalePending(Instant threshold) {
    return (int)
        notifications.values().stream()
            .filter(record -> record.status() == NotificationStatus.PENDING)
            .filter(record -> record.createdAt().isBefore(threshold))
            .count();
  }

  public synchronized Optional<NotificationRecord> latestFor(DedupKey key) {
    return notifications.values().stream()
        .filter(record -> key.employeeId().equals(record.employeeId()))
        .filter(record -> record.documentType() == key.documentType())
        .filter(record -> Objects.equals(record.thresholdDays(), key.thresholdDays()))
        .reduce((first, second) -> second);
  }
}
