package com.example.home_view.service;

import com.example.home_view.config.HomeViewProperties;
import com.example.home_view.model.BotCreationPolicy;
import com.example.home_view.model.BotType;
import com.example.home_view.model.Identity;
import com.example.home_view.model.Realm;
import com.example.home_view.model.UserRole;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class BotTypeCatalog {

  private final HomeViewProperties properties;

  public Set<BotType> allowedBotTypes(UserRole role, Realm realm) {
    final Set<BotType> allowed = EnumSet.noneOf(BotType.class);
    if (role.isRealmAdmin()
        || realm.botCreationPolicy() != BotCreationPolicy.LIMIT_GENERIC_BOTS) {
      allowed.add(BotType.INCOMING_WEBHOOK_BOT);
    }
    allowed.add(BotType.DEFAULT_BOT);
    allowed.add(BotType.OUTGOING_WEBHOOK_BOT);
    if (properties.embeddedBotsEnabled()) {
      allowed.add(BotType.EMBEDDED_BOT);
    }
    return allowed;
  }

  /** spectator には空リストを返す。 */
  public List<Map<String, Object>> describe(@Nullable Identity identity) {
    final List<Map<String, Object>> botTypes = new ArrayList<>();
    if (identity == null) {
      return botTypes;
    }
    for (BotType botType : BotType.values()) {
      final Map<String, Object> entry = new LinkedHashMap<>();
      entry.put("type_id", botType.typeId());
      entry.put("name", botType.displayName());
      entry.put("allowed", identity.allowedBotTypes().contains(botType));
      botTypes.add(entry);
    }
    return botTypes;
  }
}
