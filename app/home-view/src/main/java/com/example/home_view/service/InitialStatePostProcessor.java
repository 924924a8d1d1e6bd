/*
 * どこで: home-view サービス層
 * 何を: event queue から取得した生の初期状態をクライアント向けの形へ整える
 * なぜ: one-shot fetch の結果を登録結果と同じ形でマージできるようにするため
 */
package com.example.home_view.service;

import com.example.home_view.model.Identity;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

@Component
public class InitialStatePostProcessor {

  private static final Logger logger = LoggerFactory.getLogger(InitialStatePostProcessor.class);

  static final long NO_EVENT_ID = -1L;

  public void postProcess(
      @Nullable Identity identity, Map<String, Object> state, boolean queueBacked) {
    if (state == null) {
      throw new IllegalArgumentException("state is required");
    }
    logger.debug(
        "post-processing initial state user_id={} queue_backed={}",
        identity == null ? "spectator" : identity.userId(),
        queueBacked);
    if (state.containsKey("raw_users")) {
      splitRawUsers(state);
    }
    if (state.containsKey("raw_recent_private_conversations")) {
      sortRecentPrivateConversations(state);
    }
    if (state.containsKey("raw_unread_msgs")) {
      state.put("unread_msgs", state.remove("raw_unread_msgs"));
    }
    if (!queueBacked) {
      state.put("queue_id", null);
      state.put("last_event_id", NO_EVENT_ID);
    }
  }

  private void splitRawUsers(Map<String, Object> state) {
    final List<Map<String, Object>> users = new ArrayList<>();
    for (Object raw : valuesOf(state.remove("raw_users"), "raw_users")) {
      users.add(copyOf(raw, "raw_users"));
    }
    users.sort(Comparator.comparingLong(user -> longValue(user.get("user_id"))));
    final List<Map<String, Object>> active = new ArrayList<>();
    final List<Map<String, Object>> nonActive = new ArrayList<>();
    for (Map<String, Object> user : users) {
      final boolean isActive = Boolean.TRUE.equals(user.remove("is_active"));
      (isActive ? active : nonActive).add(user);
    }
    state.put("realm_users", active);
    state.put("realm_non_active_users", nonActive);
  }

  private void sortRecentPrivateConversations(Map<String, Object> state) {
    final List<Map<String, Object>> conversations = new ArrayList<>();
    for (Object raw :
        valuesOf(state.remove("raw_recent_private_conversations"), "raw_recent_private_conversations")) {
      conversations.add(copyOf(raw, "raw_recent_private_conversations"));
    }
    conversations.sort(
        Comparator.comparingLong(
                (Map<String, Object> conversation) -> longValue(conversation.get("max_message_id")))
            .reversed());
    state.put("recent_private_conversations", conversations);
  }

  private Iterable<?> valuesOf(Object raw, String key) {
    if (raw instanceof Map<?, ?> map) {
      return map.values();
    }
    throw new IllegalStateException(key + " must be a mapping");
  }

  private Map<String, Object> copyOf(Object raw, String key) {
    if (!(raw instanceof Map<?, ?> map)) {
      throw new IllegalStateException(key + " entries must be mappings");
    }
    final Map<String, Object> copy = new LinkedHashMap<>();
    map.forEach((entryKey, value) -> copy.put(String.valueOf(entryKey), value));
    return copy;
  }

  private long longValue(Object value) {
    if (value instanceof Number number) {
      return number.longValue();
    }
    throw new IllegalStateException("expected a numeric id but got " + value);
  }
}
