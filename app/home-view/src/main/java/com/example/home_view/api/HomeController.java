/*
 * どこで: home-view API 層
 * 何を: ホーム画面の初期状態 snapshot を返す API を提供
 * なぜ: クライアントが 1 回の呼び出しで画面描画に必要な状態を受け取れるようにするため
 */
package com.example.home_view.api;

import com.example.home_view.api.response.PageParamsResponse;
import com.example.home_view.service.HomeViewRequest;
import com.example.home_view.service.HomeViewService;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class HomeController {

  private final HomeViewService homeViewService;

  /**
   * 役割:
   * - 認証済みなら event queue を登録し、未認証なら spectator として一度だけ状態を取得して返す。
   *
   * 期待動作:
   * - パス先頭の言語コード (例: /de/v1/home/page-params) は表示言語の指定として扱う。
   * - stream が realm 内に存在しない場合は絞り込みなしで返す。
   */
  @GetMapping({"/v1/home/page-params", "/{language}/v1/home/page-params"})
  public ResponseEntity<PageParamsResponse> getPageParams(
      @RequestParam(name = "stream", required = false) String stream,
      @RequestParam(name = "topic", required = false) String topic,
      HttpServletRequest request,
      Authentication authentication) {
    final HomeViewRequest homeViewRequest =
        new HomeViewRequest(
            userIdOf(authentication),
            request.getHeader(HttpHeaders.HOST),
            request.getRequestURI(),
            request.getHeader(HttpHeaders.USER_AGENT),
            stream,
            topic);
    return ResponseEntity.ok(PageParamsResponse.from(homeViewService.load(homeViewRequest)));
  }

  private Long userIdOf(Authentication authentication) {
    if (authentication == null
        || authentication instanceof AnonymousAuthenticationToken
        || !authentication.isAuthenticated()) {
      return null;
    }
    try {
      return Long.parseLong(authentication.getName());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("forwarded user id must be numeric", ex);
    }
  }
}
