package com.example.home_view.model;

import java.time.Instant;

public record UserActivityRecord(long userId, String query, int count, Instant lastVisit) {}
