package com.example.docexpiry.model;

public enum RefreshStatus {
  SUCCESS,
  FAILED
}
