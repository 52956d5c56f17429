/*
 * どこで: Reminder 購読ストアのユニットテスト
 * 何を: JSON ファイルの読み書きと、欠損/破損ファイル・不完全エントリの扱いを検証する
 * なぜ: ストアの不具合で起動が止まったり、手編集した値が失われたりしないようにするため
 */
package com.example.reminder.repository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

import com.example.reminder.config.SubscriptionStoreProperties;
import com.example.reminder.model.EndpointDescriptor;
import com.example.reminder.model.SubscriptionRecord;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JsonFileSubscriptionStoreTest {

  private static final ObjectMapper OBJECT_MAPPER =
      JsonMapper.builder()
          .findAndAddModules()
          .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
          .build();

  @TempDir Path tempDir;

  @Test
  void missingFileLoadsEmpty() {
    final JsonFileSubscriptionStore store = store(tempDir.resolve("subscriptions.json"));

    assertThat(store.load()).isEmpty();
  }

  @Test
  void corruptFileLoadsEmpty() throws IOException {
    final Path file = tempDir.resolve("subscriptions.json");
    Files.writeString(file, "{ not json", StandardCharsets.UTF_8);

    assertThat(store(file).load()).isEmpty();
  }

  @Test
  void nonObjectRootLoadsEmpty() throws IOException {
    final Path file = tempDir.resolve("subscriptions.json");
    Files.writeString(file, "[]", StandardCharsets.UTF_8);

    assertThat(store(file).load()).isEmpty();
  }

  @Test
  void savedRecordsAreLoadedBack() {
    final JsonFileSubscriptionStore store = store(tempDir.resolve("data/subscriptions.json"));
    final Map<String, SubscriptionRecord> records = new LinkedHashMap<>();
    records.put("a", record("a", LocalDateTime.parse("2026-09-13T00:00"), null));
    records.put("b", record("b", null, Instant.parse("2026-01-18T06:00:00Z")));

    store.save(records);

    assertThat(store.load()).containsExactlyEntriesOf(records);
    assertThat(tempDir.resolve("data/subscriptions.json.tmp")).doesNotExist();
  }

  @Test
  void incompleteEntriesAreSkippedAndMalformedTimesPreserved() throws IOException {
    final Path file = tempDir.resolve("subscriptions.json");
    Files.writeString(
        file,
        """
        {
          "abc": {
            "id": "abc",
            "endpoint_descriptor": {
              "endpoint": "https://push.example.com/abc",
              "keys": {"p256dh": "key", "auth": "secret"}
            },
            "launch_time": "2026-09-13T00:00:00",
            "daily_times": ["25:00", "09:00"],
            "timezone": "Africa/Nairobi",
            "created_at": "2026-01-17T00:00:00Z"
          },
          "broken": {
            "id": "broken",
            "endpoint_descriptor": {"endpoint": "https://push.example.com/broken"}
          },
          "renamed": {
            "endpoint_descriptor": {
              "endpoint": "https://push.example.com/renamed",
              "keys": {"p256dh": "key", "auth": "secret"}
            }
          }
        }
        """,
        StandardCharsets.UTF_8);

    final Map<String, SubscriptionRecord> loaded = store(file).load();

    assertThat(loaded).containsOnlyKeys("abc", "renamed");
    assertThat(loaded.get("abc").dailyTimes()).containsExactly("25:00", "09:00");
    assertThat(loaded.get("renamed").id()).isEqualTo("renamed");
  }

  @Test
  void writeFailureDoesNotThrow() throws IOException {
    // 親ディレクトリの位置に通常ファイルがあり、書き込み先を作れない
    final Path blocker = tempDir.resolve("blocker");
    Files.writeString(blocker, "x", StandardCharsets.UTF_8);
    final JsonFileSubscriptionStore store = store(blocker.resolve("subscriptions.json"));

    assertThatCode(() -> store.save(Map.of("a", record("a", null, null))))
        .doesNotThrowAnyException();
  }

  private JsonFileSubscriptionStore store(Path file) {
    return new JsonFileSubscriptionStore(
        OBJECT_MAPPER, new SubscriptionStoreProperties(file.toString()));
  }

  private SubscriptionRecord record(String id, LocalDateTime launchTime, Instant lastSentAt) {
    return new SubscriptionRecord(
        id,
        new EndpointDescriptor(
            "https://push.example.com/" + id, new EndpointDescriptor.Keys("key", "secret")),
        launchTime,
        List.of("09:00", "18:30"),
        "Africa/Nairobi",
        Instant.parse("2026-01-17T00:00:00Z"),
        lastSentAt);
  }
}
