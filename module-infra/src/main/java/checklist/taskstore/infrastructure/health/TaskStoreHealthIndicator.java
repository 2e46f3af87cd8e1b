package checklist.taskstore.infrastructure.health;

import checklist.taskstore.error.exception.base.BaseException;
import checklist.taskstore.infrastructure.persistence.TaskStoreHealthChecker;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/** 원천 저장소 연결 상태 (헬스 기여자 이름: taskStore) */
@Component
@RequiredArgsConstructor
public class TaskStoreHealthIndicator implements HealthIndicator {

  private final TaskStoreHealthChecker healthChecker;

  @Override
  public Health health() {
    try {
      healthChecker.check();
      return Health.up().withDetail("status", "connected").build();
    } catch (BaseException e) {
      return Health.down()
          .withDetail("status", "disconnected")
          .withDetail("code", e.getErrorCode().getCode())
          .build();
    }
  }
}
