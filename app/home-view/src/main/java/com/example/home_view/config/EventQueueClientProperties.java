/*
 * どこで: home-view 設定
 * 何を: event queue サービス呼び出し設定を保持する
 * なぜ: 下流 URL と内部認証ヘッダを外部化するため
 */
package com.example.home_view.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "event-queue")
public record EventQueueClientProperties(
    String baseUrl,
    String registerPath,
    String initialStatePath,
    String internalApiHeaderName,
    String internalApiToken) {

  public EventQueueClientProperties {
    baseUrl = baseUrl == null ? "http://event-queue:80" : baseUrl;
    registerPath =
        registerPath == null || registerPath.isBlank()
            ? "/internal/v1/users/{userId}/queues"
            : registerPath;
    initialStatePath =
        initialStatePath == null || initialStatePath.isBlank()
            ? "/internal/v1/realms/{realmId}/initial-state"
            : initialStatePath;
    internalApiHeaderName =
        internalApiHeaderName == null || internalApiHeaderName.isBlank()
            ? "X-Internal-Token"
            : internalApiHeaderName;
    internalApiToken = internalApiToken == null ? "" : internalApiToken;
  }
}
