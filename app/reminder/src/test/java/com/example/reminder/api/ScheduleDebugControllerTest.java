/*
 * どこで: Reminder デバッグ API のコントローラテスト
 * 何を: 稼働中トリガーの参照と、未登録 id の 404 応答を検証する
 * なぜ: 運用時の確認手段が壊れないようにするため
 */
package com.example.reminder.api;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.reminder.model.ScheduleView;
import com.example.reminder.repository.SubscriptionRegistry;
import com.example.reminder.service.ReminderJobScheduler;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest({ScheduleDebugController.class, StatusController.class})
@AutoConfigureMockMvc(addFilters = false)
@Import(ApiExceptionHandler.class)
class ScheduleDebugControllerTest {

  @Autowired private MockMvc mockMvc;

  @MockitoBean private ReminderJobScheduler jobScheduler;
  @MockitoBean private SubscriptionRegistry registry;

  @Test
  void returnsArmedTriggers() throws Exception {
    when(jobScheduler.describe("sub-1"))
        .thenReturn(
            Optional.of(
                new ScheduleView(
                    "sub-1",
                    Instant.parse("2026-09-12T21:00:00Z"),
                    List.of("09:00 Africa/Nairobi"))));

    mockMvc
        .perform(get("/debug/reminder/schedules/sub-1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.subscription_id").value("sub-1"))
        .andExpect(jsonPath("$.launch_fire_time").value("2026-09-12T21:00:00Z"))
        .andExpect(jsonPath("$.daily_triggers[0]").value("09:00 Africa/Nairobi"));
  }

  @Test
  void unknownSubscriptionReturns404() throws Exception {
    when(jobScheduler.describe("missing")).thenReturn(Optional.empty());

    mockMvc
        .perform(get("/debug/reminder/schedules/missing"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("SUBSCRIPTION_NOT_FOUND"));
  }

  @Test
  void statusReportsSubscriptionAndTriggerCounts() throws Exception {
    when(registry.size()).thenReturn(2);
    when(jobScheduler.armedCount()).thenReturn(5);

    mockMvc
        .perform(get("/"))
        .andExpect(status().isOk())
        .andExpect(content().string("reminder: ok subscriptions=2 armed=5"));
  }
}
