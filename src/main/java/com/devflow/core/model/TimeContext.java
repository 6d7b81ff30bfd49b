package com.devflow.core.model;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZonedDateTime;

public record TimeContext(
    ZonedDateTime currentTime,
    boolean isWorkingHours,
    Instant lastUserActivity,
    DayOfWeek dayOfWeek
) {}
