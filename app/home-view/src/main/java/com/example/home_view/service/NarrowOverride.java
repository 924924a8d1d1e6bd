/*
 * どこで: home-view サービス層
 * 何を: stream へ絞り込んだ表示のときに page_params を上書きする
 * なぜ: 絞り込み表示の初期位置と通知設定を登録結果より優先させるため
 */
package com.example.home_view.service;

import com.example.home_view.model.NarrowTerm;
import com.example.home_view.model.StreamRecord;
import com.example.home_view.repository.MessageRepository;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class NarrowOverride {

  static final long NO_MESSAGES = -1L;

  private final MessageRepository messageRepository;

  /** 登録結果をマージした後に呼ぶこと。ここでの書き込みが最終値になる。 */
  public void apply(
      Map<String, Object> pageParams,
      @Nullable StreamRecord stream,
      @Nullable String topic,
      List<NarrowTerm> narrow) {
    if (stream == null) {
      return;
    }
    final Map<String, Object> userSettings =
        withDesktopNotificationsDisabled(pageParams.get("user_settings"));
    final long maxMessageId =
        messageRepository.findMaxMessageIdByRecipient(stream.recipientId()).orElse(NO_MESSAGES);
    pageParams.put("narrow_stream", stream.name());
    if (topic != null) {
      pageParams.put("narrow_topic", topic);
    }
    pageParams.put("narrow", encodeNarrow(narrow));
    pageParams.put("max_message_id", maxMessageId);
    pageParams.put("user_settings", userSettings);
  }

  private List<Map<String, Object>> encodeNarrow(List<NarrowTerm> narrow) {
    if (narrow == null) {
      return List.of();
    }
    return narrow.stream()
        .map(
            term -> {
              final Map<String, Object> encoded = new LinkedHashMap<>();
              encoded.put("operator", term.operator());
              encoded.put("operand", term.operand());
              return encoded;
            })
        .toList();
  }

  // 登録結果の入れ子 Map は共有されうるので複製してから書き換える
  private Map<String, Object> withDesktopNotificationsDisabled(Object userSettings) {
    if (!(userSettings instanceof Map<?, ?> rawSettings)) {
      throw new IllegalStateException("page_params is missing the user_settings mapping");
    }
    final Map<String, Object> copy = new LinkedHashMap<>();
    rawSettings.forEach((key, value) -> copy.put(String.valueOf(key), value));
    copy.put("enable_desktop_notifications", false);
    return copy;
  }
}
