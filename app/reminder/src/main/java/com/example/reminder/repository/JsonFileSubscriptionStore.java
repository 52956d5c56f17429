/*
 * どこで: Reminder 永続化層
 * 何を: 購読レコードを id をキーとする JSON ファイルへ読み書きする
 * なぜ: 再起動後にスケジュールを復元でき、障害時には手編集で復旧できるようにするため
 */
package com.example.reminder.repository;

import com.example.reminder.config.SubscriptionStoreProperties;
import com.example.reminder.model.SubscriptionRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

@Repository
public class JsonFileSubscriptionStore implements SubscriptionStore {

  private static final Logger logger = LoggerFactory.getLogger(JsonFileSubscriptionStore.class);

  private final ObjectMapper objectMapper;
  private final Path file;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "ObjectMapper は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  public JsonFileSubscriptionStore(
      ObjectMapper objectMapper, SubscriptionStoreProperties properties) {
    this.objectMapper = objectMapper;
    this.file = properties.file();
  }

  @Override
  public Map<String, SubscriptionRecord> load() {
    final Map<String, SubscriptionRecord> records = new LinkedHashMap<>();
    if (!Files.exists(file)) {
      logger.info("subscription store not found; starting empty path={}", file);
      return records;
    }
    final JsonNode root;
    try {
      root = objectMapper.readTree(file.toFile());
    } catch (IOException ex) {
      logger.warn("subscription store unreadable; starting empty path={}", file, ex);
      return records;
    }
    if (root == null || !root.isObject()) {
      logger.warn("subscription store is not a JSON object; starting empty path={}", file);
      return records;
    }
    final Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
    while (fields.hasNext()) {
      final Map.Entry<String, JsonNode> field = fields.next();
      readRecord(field.getKey(), field.getValue())
          .ifPresent(record -> records.put(record.id(), record));
    }
    logger.info("subscription store loaded count={} path={}", records.size(), file);
    return records;
  }

  @Override
  public void save(Map<String, SubscriptionRecord> records) {
    try {
      final Path parent = file.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      final Path temp = file.resolveSibling(file.getFileName() + ".tmp");
      objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), records);
      moveIntoPlace(temp);
    } catch (IOException | RuntimeException ex) {
      // メモリ上の状態が正なので、永続化の失敗は警告に留めて処理を継続する
      logger.warn("subscription store write failed count={} path={}", records.size(), file, ex);
    }
  }

  private Optional<SubscriptionRecord> readRecord(String key, JsonNode node) {
    try {
      final SubscriptionRecord parsed = objectMapper.treeToValue(node, SubscriptionRecord.class);
      if (parsed == null
          || parsed.endpointDescriptor() == null
          || !parsed.endpointDescriptor().isComplete()) {
        logger.warn("subscription store entry skipped: endpoint descriptor incomplete id={}", key);
        return Optional.empty();
      }
      if (parsed.id() == null || parsed.id().isBlank() || !parsed.id().equals(key)) {
        return Optional.of(
            new SubscriptionRecord(
                key,
                parsed.endpointDescriptor(),
                parsed.launchTime(),
                parsed.dailyTimes(),
                parsed.timezone(),
                parsed.createdAt(),
                parsed.lastSentAt()));
      }
      return Optional.of(parsed);
    } catch (JsonProcessingException | IllegalArgumentException ex) {
      logger.warn("subscription store entry skipped: unreadable id={}", key, ex);
      return Optional.empty();
    }
  }

  private void moveIntoPlace(Path temp) throws IOException {
    try {
      Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } catch (AtomicMoveNotSupportedException ex) {
      Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
    }
  }
}
