package com.example.home_view.service;

import com.example.home_view.model.Identity;
import com.example.home_view.model.Realm;
import com.example.home_view.model.UserProfileRecord;
import com.example.home_view.model.UserRole;
import com.example.home_view.repository.RealmRepository;
import com.example.home_view.repository.UserProfileRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class IdentityResolver {

  private final UserProfileRepository userProfileRepository;
  private final RealmRepository realmRepository;
  private final BotTypeCatalog botTypeCatalog;

  public Identity resolve(long userId) {
    final UserProfileRecord profile =
        userProfileRepository
            .findActiveByUserId(userId)
            .orElseThrow(() -> new IdentityNotFoundException("active user not found: " + userId));
    final Realm realm =
        realmRepository
            .findById(profile.realmId())
            .orElseThrow(
                () -> new RealmNotFoundException("realm not found: " + profile.realmId()));
    final UserRole role = profile.role();
    return new Identity(
        profile.userId(),
        profile.fullName(),
        realm,
        profile.colorScheme(),
        role == UserRole.GUEST,
        role.isRealmAdmin(),
        role == UserRole.OWNER,
        role == UserRole.OWNER || profile.billingAdmin(),
        botTypeCatalog.allowedBotTypes(role, realm),
        profile.defaultLanguage(),
        profile.tutorialStatus());
  }
}
