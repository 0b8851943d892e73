package com.example.docexpiry.model;

public enum NotificationStatus {
  PENDING,
  SENT,
  FAILED
}
