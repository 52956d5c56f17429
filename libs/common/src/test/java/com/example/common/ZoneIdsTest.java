package com.example.common;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.ZoneId;
import org.junit.jupiter.api.Test;

class ZoneIdsTest {

  @Test
  void parseReturnsZoneForValidIanaId() {
    assertThat(ZoneIds.parse(" Africa/Nairobi ")).contains(ZoneId.of("Africa/Nairobi"));
  }

  @Test
  void parseReturnsEmptyForBlankOrUnknownId() {
    assertThat(ZoneIds.parse(null)).isEmpty();
    assertThat(ZoneIds.parse("  ")).isEmpty();
    assertThat(ZoneIds.parse("Mars/Olympus")).isEmpty();
  }
}
