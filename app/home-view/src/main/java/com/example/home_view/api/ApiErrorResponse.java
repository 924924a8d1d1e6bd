package com.example.home_view.api;

public record ApiErrorResponse(String code, String message) {}
