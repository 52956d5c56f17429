/*
 * どこで: Reminder サービス層
 * 何を: 受信者 1 件へ通知を 1 回送る処理の抽象化
 * なぜ: 実送信/ローカル送信/失敗注入を差し替え、結果分類を呼び出し側から切り離すため
 */
package com.example.reminder.service;

import com.example.reminder.model.DispatchOutcome;
import com.example.reminder.model.EndpointDescriptor;
import com.example.reminder.model.NotificationPayload;

public interface DispatchClient {

  /**
   * 通知を 1 回送信して結果を分類する。再送もストア更新も行わない。
   *
   * <p>実装は送信失敗を例外ではなく {@link DispatchOutcome#RETRYABLE} で返す。
   */
  DispatchOutcome send(EndpointDescriptor endpoint, NotificationPayload payload);
}
