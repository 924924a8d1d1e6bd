package com.example.home_view.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record UserPermissionInfo(
    ColorScheme colorScheme,
    boolean guest,
    boolean realmAdmin,
    boolean realmOwner,
    boolean showWebathena) {

  public static final UserPermissionInfo ANONYMOUS =
      new UserPermissionInfo(ColorScheme.AUTOMATIC, false, false, false, false);
}
