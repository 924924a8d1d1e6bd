package com.example.home_view.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.home_view.config.LocalizationProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.context.i18n.LocaleContextHolder;

class LocalizationServiceTest {

  private final LocalizationService service =
      new LocalizationService(
          new LocalizationProperties(
              "en",
              List.of(
                  new LocalizationProperties.Language("en", "English", "en", 100),
                  new LocalizationProperties.Language("de", "Deutsch", "de", 92),
                  new LocalizationProperties.Language("pt-br", "Português", "pt_BR", 78),
                  new LocalizationProperties.Language("xx", "Broken", "xx", 1))),
          new ObjectMapper());

  @AfterEach
  void cleanup() {
    LocaleContextHolder.resetLocaleContext();
  }

  @Test
  void listLanguagesKeepsConfiguredOrder() {
    final List<Map<String, Object>> languages = service.listLanguages();

    assertThat(languages).extracting(language -> language.get("code"))
        .containsExactly("en", "de", "pt-br", "xx");
    assertThat(languages.get(1))
        .containsEntry("name", "Deutsch")
        .containsEntry("locale", "de")
        .containsEntry("percent_translated", 92);
  }

  @Test
  void languageFromPathUsesFirstSupportedSegment() {
    assertThat(service.languageFromPath("/de/v1/home/page-params")).isEqualTo("de");
    assertThat(service.languageFromPath("/v1/home/page-params")).isNull();
    assertThat(service.languageFromPath(null)).isNull();
  }

  @Test
  void pathLanguageWinsOverUserDefault() {
    assertThat(service.resolveRequestLanguage("de", "en")).isEqualTo("de");
    assertThat(LocaleContextHolder.getLocale()).isEqualTo(Locale.GERMAN);
  }

  @Test
  void unsupportedLanguagesFallBack() {
    assertThat(service.resolveRequestLanguage("klingon", "pt-BR")).isEqualTo("pt-br");
    assertThat(LocaleContextHolder.getLocale()).isEqualTo(Locale.forLanguageTag("pt-BR"));
    assertThat(service.resolveRequestLanguage(null, "klingon")).isEqualTo("en");
  }

  @Test
  void translationDataLoadsCatalogFromClasspath() {
    final Map<String, String> translations = service.translationData("de");

    assertThat(translations).containsEntry("Home", "Startseite");
    assertThat(service.translationData("de")).isSameAs(translations);
  }

  @Test
  void translationDataIsEmptyWithoutCatalog() {
    assertThat(service.translationData("en")).isEmpty();
    assertThat(service.translationData("klingon")).isEmpty();
  }

  @Test
  void translationDataFailsOnUnreadableCatalog() {
    assertThatThrownBy(() -> service.translationData("xx"))
        .isInstanceOf(IllegalStateException.class);
  }
}
