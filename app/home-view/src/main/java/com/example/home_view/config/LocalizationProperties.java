/*
 * どこで: home-view 設定
 * 何を: 提供言語一覧とフォールバック言語を保持する
 * なぜ: 言語カタログを環境ごとに差し替えられるようにするため
 */
package com.example.home_view.config;

import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "home.i18n")
public record LocalizationProperties(String fallbackLanguage, List<Language> languages) {

  public LocalizationProperties {
    fallbackLanguage =
        fallbackLanguage == null || fallbackLanguage.isBlank() ? "en" : fallbackLanguage;
    languages =
        languages == null || languages.isEmpty()
            ? List.of(new Language("en", "English", "en", null))
            : List.copyOf(languages);
  }

  public record Language(String code, String name, String locale, Integer percentTranslated) {

    public Language {
      if (code == null || code.isBlank()) {
        throw new IllegalArgumentException("language code is required");
      }
      name = name == null || name.isBlank() ? code : name;
      locale = locale == null || locale.isBlank() ? code : locale;
    }
  }
}
