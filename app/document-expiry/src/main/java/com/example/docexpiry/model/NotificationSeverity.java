package com.example.docexpiry.model;

public enum NotificationSeverity {
  SUCCESS,
  WARNING,
  ERROR,
  INFO
}
