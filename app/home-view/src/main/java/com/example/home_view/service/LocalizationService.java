package com.example.home_view.service;

import com.example.home_view.config.LocalizationProperties;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.i18n.LocaleContextHolder;
import org.springframework.core.io.ClassPathResource;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

@Service
public class LocalizationService {

  private static final Logger logger = LoggerFactory.getLogger(LocalizationService.class);
  private static final TypeReference<Map<String, String>> CATALOG_TYPE = new TypeReference<>() {};

  private final LocalizationProperties properties;
  private final ObjectMapper objectMapper;
  private final ConcurrentMap<String, Map<String, String>> catalogs = new ConcurrentHashMap<>();

  public LocalizationService(LocalizationProperties properties, ObjectMapper objectMapper) {
    this.properties = properties;
    this.objectMapper = objectMapper;
  }

  public List<Map<String, Object>> listLanguages() {
    return properties.languages().stream()
        .map(
            language -> {
              final Map<String, Object> entry = new LinkedHashMap<>();
              entry.put("name", language.name());
              entry.put("code", language.code());
              entry.put("locale", language.locale());
              entry.put("percent_translated", language.percentTranslated());
              return entry;
            })
        .toList();
  }

  /** パス先頭のセグメントが提供言語コードならそれを返す。 */
  @Nullable
  public String languageFromPath(@Nullable String path) {
    if (path == null || path.isBlank()) {
      return null;
    }
    for (String segment : path.split("/")) {
      if (!segment.isEmpty()) {
        return find(segment).map(LocalizationProperties.Language::code).orElse(null);
      }
    }
    return null;
  }

  /**
   * 有効な表示言語を決め、現在のリクエストのロケールへ反映する。
   *
   * <p>優先順: パス指定 → ユーザー既定 → フォールバック。
   */
  public String resolveRequestLanguage(
      @Nullable String pathLanguage, @Nullable String defaultLanguage) {
    final LocalizationProperties.Language language =
        find(pathLanguage)
            .or(() -> find(defaultLanguage))
            .or(() -> find(properties.fallbackLanguage()))
            .orElse(properties.languages().get(0));
    LocaleContextHolder.setLocale(Locale.forLanguageTag(language.locale().replace('_', '-')));
    return language.code();
  }

  public Map<String, String> translationData(String language) {
    if (find(language).isEmpty()) {
      return Map.of();
    }
    return catalogs.computeIfAbsent(language.toLowerCase(Locale.ROOT), this::loadCatalog);
  }

  private Optional<LocalizationProperties.Language> find(@Nullable String code) {
    if (code == null || code.isBlank()) {
      return Optional.empty();
    }
    return properties.languages().stream()
        .filter(language -> language.code().equalsIgnoreCase(code.trim()))
        .findFirst();
  }

  private Map<String, String> loadCatalog(String code) {
    final ClassPathResource resource = new ClassPathResource("locale/" + code + "/translations.json");
    if (!resource.exists()) {
      logger.debug("translation catalog not found language={}", code);
      return Map.of();
    }
    try (InputStream input = resource.getInputStream()) {
      return Map.copyOf(objectMapper.readValue(input, CATALOG_TYPE));
    } catch (IOException ex) {
      logger.warn("translation catalog parse failed language={}", code, ex);
      throw new IllegalStateException("translation catalog is unreadable: " + code, ex);
    }
  }
}
