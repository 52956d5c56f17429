package com.example.reminder.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CountdownResponse(
    long days,
    String targetDateIso,
    String targetDateString,
    @JsonProperty("is_today") boolean isToday,
    String timezone) {}
