package com.example.home_view.api;

import com.example.home_view.service.EventQueueIntegrationException;
import com.example.home_view.service.IdentityNotFoundException;
import com.example.home_view.service.RealmNotFoundException;
import com.example.home_view.service.SpectatorAccessDeniedException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class HomeApiExceptionHandler {

  @ExceptionHandler(EventQueueIntegrationException.class)
  public ResponseEntity<ApiErrorResponse> handleEventQueueIntegration(
      EventQueueIntegrationException ex) {
    final String code =
        switch (ex.reason()) {
          case BAD_REQUEST -> "EVENT_QUEUE_BAD_REQUEST";
          case UNAUTHORIZED -> "EVENT_QUEUE_UNAUTHORIZED";
          case NOT_FOUND -> "EVENT_QUEUE_NOT_FOUND";
          case TIMEOUT -> "EVENT_QUEUE_TIMEOUT";
          case INVALID_RESPONSE -> "EVENT_QUEUE_INVALID_RESPONSE";
          case BAD_GATEWAY -> "EVENT_QUEUE_BAD_GATEWAY";
        };
    final HttpStatus status =
        switch (ex.reason()) {
          case BAD_REQUEST -> HttpStatus.BAD_REQUEST;
          case NOT_FOUND -> HttpStatus.NOT_FOUND;
          case TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
          case UNAUTHORIZED, INVALID_RESPONSE, BAD_GATEWAY -> HttpStatus.BAD_GATEWAY;
        };
    return ResponseEntity.status(status).body(new ApiErrorResponse(code, ex.getMessage()));
  }

  @ExceptionHandler(RealmNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleRealmNotFound(RealmNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(new ApiErrorResponse("REALM_NOT_FOUND", ex.getMessage()));
  }

  @ExceptionHandler(SpectatorAccessDeniedException.class)
  public ResponseEntity<ApiErrorResponse> handleSpectatorAccessDenied(
      SpectatorAccessDeniedException ex) {
    return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
        .body(new ApiErrorResponse("SPECTATOR_ACCESS_DENIED", ex.getMessage()));
  }

  @ExceptionHandler(IdentityNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleIdentityNotFound(IdentityNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
        .body(new ApiErrorResponse("IDENTITY_NOT_FOUND", ex.getMessage()));
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ApiErrorResponse> handleBadRequest(IllegalArgumentException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("BAD_REQUEST", ex.getMessage()));
  }
}
