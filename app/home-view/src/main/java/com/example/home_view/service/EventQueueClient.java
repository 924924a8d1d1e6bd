/*
 * どこで: home-view サービス層
 * 何を: event queue サービスへの登録と初期状態取得を担当するクライアント
 * なぜ: 認証済みセッションの queue 登録と spectator の one-shot 取得を下流へ委譲するため
 */
package com.example.home_view.service;

import com.example.home_view.config.EventQueueClientProperties;
import com.example.home_view.model.ClientCapabilities;
import com.example.home_view.model.EventQueueRegistration;
import com.example.home_view.model.Identity;
import com.example.home_view.model.NarrowTerm;
import com.example.home_view.model.Realm;
import com.example.home_view.service.dto.EventQueueRegisterRequest;
import com.example.home_view.service.dto.InitialStateFetchRequest;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.net.SocketTimeoutException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

@Service
public class EventQueueClient {

  private static final Logger logger = LoggerFactory.getLogger(EventQueueClient.class);
  private static final ParameterizedTypeReference<LinkedHashMap<String, Object>> STATE_TYPE =
      new ParameterizedTypeReference<>() {};

  private final RestClient eventQueueRestClient;
  private final EventQueueClientProperties properties;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  public EventQueueClient(
      RestClient eventQueueRestClient, EventQueueClientProperties properties) {
    this.eventQueueRestClient = eventQueueRestClient;
    this.properties = properties;
  }

  public EventQueueRegistration register(
      Identity identity,
      String clientName,
      ClientCapabilities capabilities,
      List<NarrowTerm> narrow,
      RegisterOptions options) {
    if (identity == null) {
      throw new IllegalArgumentException("identity is required");
    }
    final EventQueueRegisterRequest request =
        new EventQueueRegisterRequest(
            clientName,
            options.applyMarkdown(),
            options.clientGravatar(),
            options.slimPresence(),
            options.includeStreams(),
            capabilities,
            narrow == null
                ? List.of()
                : narrow.stream().map(term -> List.of(term.operator(), term.operand())).toList());
    final Map<String, Object> state =
        call(
            "register",
            () ->
                eventQueueRestClient
                    .post()
                    .uri(properties.registerPath(), identity.userId())
                    .header(properties.internalApiHeaderName(), properties.internalApiToken())
                    .body(request)
                    .retrieve()
                    .body(STATE_TYPE));
    final Object queueId = state.get("queue_id");
    if (!(queueId instanceof String value) || value.isBlank()) {
      throw new EventQueueIntegrationException(
          EventQueueIntegrationException.Reason.INVALID_RESPONSE,
          "event queue registration has no queue_id");
    }
    return new EventQueueRegistration(value, state);
  }

  public Map<String, Object> fetchInitialState(Realm realm, InitialStateFetchRequest request) {
    if (realm == null) {
      throw new IllegalArgumentException("realm is required");
    }
    return call(
        "fetchInitialState",
        () ->
            eventQueueRestClient
                .post()
                .uri(properties.initialStatePath(), realm.realmId())
                .header(properties.internalApiHeaderName(), properties.internalApiToken())
                .body(request)
                .retrieve()
                .body(STATE_TYPE));
  }

  private Map<String, Object> call(String operation, Supplier<Map<String, Object>> exchange) {
    try {
      final Map<String, Object> state = exchange.get();
      if (state == null) {
        throw new EventQueueIntegrationException(
            EventQueueIntegrationException.Reason.INVALID_RESPONSE,
            "event queue " + operation + " returned an empty body");
      }
      return state;
    } catch (RestClientResponseException ex) {
      throw mapResponseException(ex, operation);
    } catch (ResourceAccessException ex) {
      throw mapResourceException(ex, operation);
    } catch (EventQueueIntegrationException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      logger.warn("event queue {} response parse failed", operation, ex);
      throw new EventQueueIntegrationException(
          EventQueueIntegrationException.Reason.INVALID_RESPONSE,
          "event queue response parse failed",
          ex);
    }
  }

  private EventQueueIntegrationException mapResponseException(
      RestClientResponseException ex, String operation) {
    final int status = ex.getStatusCode().value();
    logger.warn(
        "event queue {} failed with http status={} statusText={}",
        operation,
        status,
        ex.getStatusText());
    if (status == 400) {
      return new EventQueueIntegrationException(
          EventQueueIntegrationException.Reason.BAD_REQUEST, "event queue rejected the request", ex);
    }
    if (status == 401 || status == 403) {
      return new EventQueueIntegrationException(
          EventQueueIntegrationException.Reason.UNAUTHORIZED,
          "event queue rejected internal auth",
          ex);
    }
    if (status == 404) {
      return new EventQueueIntegrationException(
          EventQueueIntegrationException.Reason.NOT_FOUND, "event queue target not found", ex);
    }
    if (ex.getStatusCode().is5xxServerError()) {
      return new EventQueueIntegrationException(
          EventQueueIntegrationException.Reason.BAD_GATEWAY, "event queue server error", ex);
    }
    return new EventQueueIntegrationException(
        EventQueueIntegrationException.Reason.BAD_GATEWAY, "event queue request failed", ex);
  }

  private EventQueueIntegrationException mapResourceException(
      ResourceAccessException ex, String operation) {
    if (isTimeout(ex)) {
      logger.warn("event queue {} timed out", operation);
      return new EventQueueIntegrationException(
          EventQueueIntegrationException.Reason.TIMEOUT, "event queue request timeout", ex);
    }
    logger.warn("event queue {} connection failed", operation, ex);
    return new EventQueueIntegrationException(
        EventQueueIntegrationException.Reason.BAD_GATEWAY, "event queue connection failed", ex);
  }

  private boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }

  public record RegisterOptions(
      boolean applyMarkdown, boolean clientGravatar, boolean slimPresence, boolean includeStreams) {}
}
