/*
 * どこで: Reminder サービス層
 * 何を: 未登録の購読 id を指定されたことを示す例外
 * なぜ: API 層で 404 へ一貫変換するため
 */
package com.example.reminder.service;

public class SubscriptionNotFoundException extends RuntimeException {

  private final String subscriptionId;

  public SubscriptionNotFoundException(String subscriptionId) {
    super("subscription not found: " + subscriptionId);
    this.subscriptionId = subscriptionId;
  }

  public String subscriptionId() {
    return subscriptionId;
  }
}
