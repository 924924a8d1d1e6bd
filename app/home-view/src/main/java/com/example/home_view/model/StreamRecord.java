package com.example.home_view.model;

public record StreamRecord(long streamId, long realmId, String name, long recipientId) {}
