package com.example.home_view.service.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/** spectator 向けの one-shot 取得。queue は割り当てない。 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record InitialStateFetchRequest(
    boolean clientGravatar,
    boolean userAvatarUrlFieldOptional,
    boolean userSettingsObject,
    boolean slimPresence,
    boolean includeSubscribers,
    boolean includeStreams) {}
