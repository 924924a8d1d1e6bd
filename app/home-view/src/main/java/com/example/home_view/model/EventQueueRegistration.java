package com.example.home_view.model;

import java.util.LinkedHashMap;
import java.util.Map;

/** queueId は spectator の one-shot fetch では null になる。 */
public record EventQueueRegistration(String queueId, Map<String, Object> state) {

  public EventQueueRegistration {
    state = state == null ? new LinkedHashMap<>() : state;
  }
}
