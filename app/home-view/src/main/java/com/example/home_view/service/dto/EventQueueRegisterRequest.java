package com.example.home_view.service.dto;

import com.example.home_view.model.ClientCapabilities;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record EventQueueRegisterRequest(
    String client,
    boolean applyMarkdown,
    boolean clientGravatar,
    boolean slimPresence,
    boolean includeStreams,
    ClientCapabilities clientCapabilities,
    List<List<String>> narrow) {

  public EventQueueRegisterRequest {
    narrow = narrow == null ? List.of() : List.copyOf(narrow);
  }
}
