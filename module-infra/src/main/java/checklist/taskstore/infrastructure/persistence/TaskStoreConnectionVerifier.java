package checklist.taskstore.infrastructure.persistence;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;

/**
 * 기동 시 저장소 연결 확인
 *
 * <p>고정 간격으로 정해진 횟수만큼 재시도한 뒤에도 실패하면 마지막 예외를 그대로 던져 기동을 중단합니다. 요청 처리 중 연결 실패는 재시도하지 않습니다.
 */
@Slf4j
public class TaskStoreConnectionVerifier {

  private static final String RETRY_NAME = "taskStoreStartup";

  private final TaskStoreHealthChecker healthChecker;
  private final Retry retry;

  public TaskStoreConnectionVerifier(
      TaskStoreHealthChecker healthChecker, int maxAttempts, Duration backoff) {
    this.healthChecker = healthChecker;
    this.retry = Retry.of(RETRY_NAME, retryConfig(maxAttempts, backoff));
    this.retry
        .getEventPublisher()
        .onRetry(
            event ->
                log.warn(
                    "[Startup] Task store connection attempt {}/{} failed, retrying in {}ms: {}",
                    event.getNumberOfRetryAttempts(),
                    maxAttempts,
                    event.getWaitInterval().toMillis(),
                    errorType(event.getLastThrowable())))
        .onError(
            event ->
                log.error(
                    "[Startup] Task store unreachable after {} attempts: {}",
                    event.getNumberOfRetryAttempts(),
                    errorType(event.getLastThrowable())));
  }

  private static String errorType(Throwable error) {
    return error != null ? error.getClass().getSimpleName() : "unknown";
  }

  private static RetryConfig retryConfig(int maxAttempts, Duration backoff) {
    return RetryConfig.custom()
        .maxAttempts(maxAttempts)
        .intervalFunction(IntervalFunction.of(backoff))
        .build();
  }

  /**
   * @throws RuntimeException 모든 시도가 실패한 경우 마지막 예외
   */
  public void verify() {
    retry.executeRunnable(healthChecker::check);
    log.info("[Startup] Task store connection verified");
  }
}
