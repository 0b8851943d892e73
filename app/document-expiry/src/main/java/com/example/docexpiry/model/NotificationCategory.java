package com.example.docexpiry.model;

public enum NotificationCategory {
  VISA,
  DOCUMENT,
  SYSTEM,
  APPROVAL
}
