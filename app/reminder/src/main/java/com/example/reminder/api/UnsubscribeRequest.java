/*
 * どこで: Reminder API
 * 何を: 購読解除リクエストの入力を保持する
 * なぜ: id 指定と endpoint 指定のどちらでも解除できるようにするため
 */
package com.example.reminder.api;

import com.example.reminder.model.EndpointDescriptor;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record UnsubscribeRequest(String id, String endpoint, EndpointDescriptor subscription) {

  public String resolvedEndpoint() {
    if (endpoint != null && !endpoint.isBlank()) {
      return endpoint;
    }
    return subscription == null ? null : subscription.endpoint();
  }
}
