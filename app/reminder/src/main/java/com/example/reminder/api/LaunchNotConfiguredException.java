package com.example.reminder.api;

public class LaunchNotConfiguredException extends RuntimeException {

  public LaunchNotConfiguredException() {
    super("launch time is not configured");
  }
}
