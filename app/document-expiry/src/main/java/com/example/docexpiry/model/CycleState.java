package com.example.docexpiry.model;

public enum CycleState {
  IDLE,
  RUNNING
}
