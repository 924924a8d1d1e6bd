package com.example.home_view.api.response;

import com.example.home_view.model.PageParams;
import com.example.home_view.model.UserPermissionInfo;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PageParamsResponse(
    String queueId, Map<String, Object> pageParams, UserPermissionInfo permissionInfo) {

  public static PageParamsResponse from(PageParams pageParams) {
    return new PageParamsResponse(
        pageParams.queueId(), pageParams.pageParams(), pageParams.permissionInfo());
  }
}
