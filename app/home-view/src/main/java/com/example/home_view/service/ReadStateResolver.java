package com.example.home_view.service;

import com.example.common.JdbcTimestampUtils;
import com.example.home_view.model.Identity;
import com.example.home_view.repository.UserActivityRepository;
import java.time.Clock;
import lombok.RequiredArgsConstructor;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ReadStateResolver {

  private final Clock clock;
  private final UserActivityRepository userActivityRepository;

  /**
   * 既読位置の基準時刻を UTC epoch 秒で返す。
   *
   * <p>spectator は常に「現在まで既読」とみなす。認証済みで既読操作の履歴が無い場合は null。
   */
  @Nullable
  public Double furthestReadTime(@Nullable Identity identity) {
    if (identity == null) {
      return clock.millis() / 1000.0d;
    }
    return userActivityRepository
        .findLatestUpdateMessageFlagActivity(identity.userId())
        .map(activity -> (double) JdbcTimestampUtils.toEpochSeconds(activity.lastVisit()))
        .orElse(null);
  }
}
