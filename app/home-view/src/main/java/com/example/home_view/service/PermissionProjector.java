package com.example.home_view.service;

import com.example.home_view.model.Identity;
import com.example.home_view.model.Realm;
import com.example.home_view.model.UserPermissionInfo;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

// 認証済みユーザーの権限を UI 表示用の最小形へ射影する。
@Component
public class PermissionProjector {

  public UserPermissionInfo project(@Nullable Identity identity, Realm realm) {
    if (identity == null) {
      return UserPermissionInfo.ANONYMOUS;
    }
    return new UserPermissionInfo(
        identity.colorScheme(),
        identity.guest(),
        identity.realmAdmin(),
        identity.realmOwner(),
        identity.realm().webathenaEnabled());
  }
}
