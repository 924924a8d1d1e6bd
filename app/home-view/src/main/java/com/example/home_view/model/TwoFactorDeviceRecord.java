package com.example.home_view.model;

public record TwoFactorDeviceRecord(long deviceId, long userId, String name, boolean confirmed) {}
