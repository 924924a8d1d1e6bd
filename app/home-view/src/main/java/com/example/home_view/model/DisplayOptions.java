package com.example.home_view.model;

import java.util.List;

public record DisplayOptions(
    boolean insecureDesktopApp,
    List<NarrowTerm> narrow,
    StreamRecord narrowStream,
    String narrowTopic,
    boolean firstInRealm,
    boolean promptForInvites,
    boolean needsTutorial,
    String pathLanguage) {

  public DisplayOptions {
    narrow = narrow == null ? List.of() : List.copyOf(narrow);
  }

  public static DisplayOptions plain() {
    return new DisplayOptions(false, List.of(), null, null, false, false, false, null);
  }
}
