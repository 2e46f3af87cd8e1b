package checklist.taskstore.infrastructure.health;

import checklist.taskstore.core.port.out.CacheOutcome;
import checklist.taskstore.core.port.out.TaskCachePort;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * 캐시 샤드 연결 상태 (헬스 기여자 이름: taskCache)
 *
 * <p>캐시 비활성은 장애가 아니므로 UP 으로 보고합니다. 샤드 주소는 노출하지 않습니다.
 */
@Component
@RequiredArgsConstructor
public class TaskCacheHealthIndicator implements HealthIndicator {

  private final TaskCachePort cache;

  @Override
  public Health health() {
    CacheOutcome outcome = cache.ping();
    return switch (outcome.status()) {
      case APPLIED -> Health.up().withDetail("mode", "enabled").build();
      case SKIPPED -> Health.up().withDetail("mode", "disabled").build();
      case FAILED -> Health.down()
          .withDetail("mode", "enabled")
          .withDetail("errorType", outcome.error().getClass().getSimpleName())
          .build();
    };
  }
}
