package com.example.reminder.model;

public enum TriggerKind {
  LAUNCH,
  DAILY,
  MANUAL
}
