package com.example.home_view.model;

import java.util.Collections;
import java.util.Map;

/**
 * クライアントへ渡す初期状態 snapshot。
 *
 * <p>pageParams は挿入順を保持した読み取り専用ビュー。queueId は spectator では null。
 */
public record PageParams(
    String queueId, Map<String, Object> pageParams, UserPermissionInfo permissionInfo) {

  public PageParams {
    pageParams = pageParams == null ? Map.of() : Collections.unmodifiableMap(pageParams);
    permissionInfo = permissionInfo == null ? UserPermissionInfo.ANONYMOUS : permissionInfo;
  }
}
