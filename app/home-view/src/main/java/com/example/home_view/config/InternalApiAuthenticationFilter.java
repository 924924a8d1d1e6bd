/*
 * どこで: home-view セキュリティ
 * 何を: gateway が転送した内部トークンとユーザー ID から認証を確立する
 * なぜ: 認証済みセッションと spectator セッションを区別するため
 */
package com.example.home_view.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

public class InternalApiAuthenticationFilter extends OncePerRequestFilter {

  private static final Logger logger =
      LoggerFactory.getLogger(InternalApiAuthenticationFilter.class);
  private static final String USER_ROLE = "ROLE_USER";

  private final InternalApiProperties properties;

  public InternalApiAuthenticationFilter(InternalApiProperties properties) {
    this.properties = properties;
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    final String forwardedUserId = request.getHeader(properties.userIdHeaderName());
    if (isBlank(forwardedUserId)) {
      // ユーザー ID がなければ spectator として通す
      filterChain.doFilter(request, response);
      return;
    }
    if (!isValidInternalToken(request.getHeader(properties.headerName()))) {
      logger.warn(
          "forwarded user rejected: invalid internal token on path={}", request.getRequestURI());
      response.sendError(HttpServletResponse.SC_UNAUTHORIZED);
      return;
    }
    final UsernamePasswordAuthenticationToken authentication =
        new UsernamePasswordAuthenticationToken(
            forwardedUserId.trim(), "N/A", List.of(new SimpleGrantedAuthority(USER_ROLE)));
    logger.debug("internal authentication established for path={}", request.getRequestURI());
    SecurityContextHolder.getContext().setAuthentication(authentication);
    filterChain.doFilter(request, response);
  }

  private boolean isValidInternalToken(String actualToken) {
    return actualToken != null
        && !properties.token().isBlank()
        && actualToken.equals(properties.token());
  }

  private boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
