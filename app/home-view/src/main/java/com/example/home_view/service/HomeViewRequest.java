package com.example.home_view.service;

import org.springframework.lang.Nullable;

/** HTTP リクエストから取り出したホーム画面ロードの入力。userId は spectator では null。 */
public record HomeViewRequest(
    @Nullable Long userId,
    @Nullable String host,
    @Nullable String path,
    @Nullable String userAgent,
    @Nullable String stream,
    @Nullable String topic) {}
