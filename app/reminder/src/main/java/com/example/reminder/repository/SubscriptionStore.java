/*
 * どこで: Reminder 永続化層
 * 何を: 購読レコードの一括ロード/保存を抽象化する
 * なぜ: ファイル実装とテスト用スタブを差し替え可能にするため
 */
package com.example.reminder.repository;

import com.example.reminder.model.SubscriptionRecord;
import java.util.Map;

/**
 * 購読レコードのベストエフォートな永続化。
 *
 * <p>どちらの操作も例外を投げない。読み込みに失敗した場合は空のマップを返し、書き込みに失敗した場合はログだけ残す。
 */
public interface SubscriptionStore {

  Map<String, SubscriptionRecord> load();

  void save(Map<String, SubscriptionRecord> records);
}
