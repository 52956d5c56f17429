/*
 * どこで: Reminder アプリの設定バインド
 * 何を: 購読ストア (JSON ファイル) の保存先を保持する
 * なぜ: コンテナのボリューム配置に合わせてパスを切り替えるため
 */
package com.example.reminder.config;

import java.nio.file.Path;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "reminder.store")
public record SubscriptionStoreProperties(String path) {

  public SubscriptionStoreProperties {
    path = path == null || path.isBlank() ? "subscriptions.json" : path;
  }

  public Path file() {
    return Path.of(path);
  }
}
