/*
 * どこで: Reminder 永続化層
 * 何を: 購読レコードのメモリ上の正本を保持し、変更のたびにストアへ書き出す
 * なぜ: 複数受信者の同時削除でも read-modify-persist を直列化し、更新の取りこぼしを防ぐため
 */
package com.example.reminder.repository;

import com.example.reminder.model.SubscriptionRecord;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class SubscriptionRegistry {

  private static final Logger logger = LoggerFactory.getLogger(SubscriptionRegistry.class);

  private final SubscriptionStore store;
  private final ReentrantLock lock = new ReentrantLock();
  private final Map<String, SubscriptionRecord> records = new LinkedHashMap<>();

  public SubscriptionRegistry(SubscriptionStore store) {
    this.store = store;
  }

  /** ストアの内容でメモリ上の状態を置き換える。 */
  public List<SubscriptionRecord> reload() {
    lock.lock();
    try {
      records.clear();
      records.putAll(store.load());
      return List.copyOf(records.values());
    } finally {
      lock.unlock();
    }
  }

  public Optional<SubscriptionRecord> find(String id) {
    if (id == null) {
      return Optional.empty();
    }
    lock.lock();
    try {
      return Optional.ofNullable(records.get(id));
    } finally {
      lock.unlock();
    }
  }

  public Optional<SubscriptionRecord> findByEndpoint(String endpoint) {
    if (endpoint == null) {
      return Optional.empty();
    }
    lock.lock();
    try {
      return records.values().stream()
          .filter(record -> endpoint.equals(record.endpoint()))
          .findFirst();
    } finally {
      lock.unlock();
    }
  }

  /**
   * 購読を登録する。同じ endpoint の購読が既にあれば、その id と作成時刻を保ったまま内容を差し替える。
   *
   * @return 実際に保存されたレコード
   */
  public SubscriptionRecord upsert(SubscriptionRecord candidate) {
    Objects.requireNonNull(candidate, "candidate");
    lock.lock();
    try {
      final SubscriptionRecord stored =
          records.values().stream()
              .filter(existing -> Objects.equals(existing.endpoint(), candidate.endpoint()))
              .findFirst()
              .map(existing -> existing.replacedBy(candidate))
              .orElse(candidate);
      if (stored != candidate) {
        logger.info("subscription updated in place id={} endpoint={}", stored.id(), stored.endpoint());
      }
      records.put(stored.id(), stored);
      persist();
      return stored;
    } finally {
      lock.unlock();
    }
  }

  public Optional<SubscriptionRecord> remove(String id) {
    if (id == null) {
      return Optional.empty();
    }
    lock.lock();
    try {
      final SubscriptionRecord removed = records.remove(id);
      if (removed != null) {
        persist();
      }
      return Optional.ofNullable(removed);
    } finally {
      lock.unlock();
    }
  }

  /** 最終送信時刻を更新する。削除済みの id なら何もしない。 */
  public void markSent(String id, Instant sentAt) {
    lock.lock();
    try {
      final SubscriptionRecord current = records.get(id);
      if (current == null) {
        return;
      }
      records.put(id, current.withLastSentAt(sentAt));
      persist();
    } finally {
      lock.unlock();
    }
  }

  public List<SubscriptionRecord> snapshot() {
    lock.lock();
    try {
      return List.copyOf(records.values());
    } finally {
      lock.unlock();
    }
  }

  public int size() {
    lock.lock();
    try {
      return records.size();
    } finally {
      lock.unlock();
    }
  }

  private void persist() {
    store.save(new LinkedHashMap<>(records));
  }
}
