/*
 * どこで: Common 時刻ユーティリティ
 * 何を: IANA タイムゾーン ID を検証付きで解決する
 * なぜ: 受付時の検証と計画時のフォールバックで同じ解釈を使うため
 */
package com.example.common;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.Optional;

public final class ZoneIds {

  private ZoneIds() {}

  public static Optional<ZoneId> parse(String zoneId) {
    if (zoneId == null || zoneId.isBlank()) {
      return Optional.empty();
    }
    try {
      return Optional.of(ZoneId.of(zoneId.trim()));
    } catch (DateTimeException ex) {
      return Optional.empty();
    }
  }
}
