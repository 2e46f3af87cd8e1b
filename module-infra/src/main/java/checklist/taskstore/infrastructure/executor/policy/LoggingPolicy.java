package checklist.taskstore.infrastructure.executor.policy;

import static checklist.taskstore.infrastructure.executor.policy.TaskLogSupport.formatDuration;
import static checklist.taskstore.infrastructure.executor.policy.TaskLogTags.*;

import checklist.taskstore.error.exception.base.ClientBaseException;
import checklist.taskstore.infrastructure.executor.TaskContext;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;

/**
 * 작업 실행 단계별 로깅을 수행하는 정책 (Stateless)
 *
 * <ul>
 *   <li>before: [Task:START] {taskName} -> DEBUG
 *   <li>onSuccess: [Task:SUCCESS] -> DEBUG, 임계치 이상이면 [Task:SLOW] -> INFO
 *   <li>onFailure: 호출자 책임 예외(NotFound 등) -> DEBUG (stacktrace 없음), best-effort 컴포넌트(캐시) ->
 *       WARN (stacktrace 없음), 그 외 -> ERROR (stacktrace)
 *   <li>after: [Task:AFTER] {taskName}, outcome=..., elapsed=... -> DEBUG
 * </ul>
 */
@Slf4j
@Order(PolicyOrder.LOGGING)
public class LoggingPolicy implements ExecutionPolicy {

  private static final long MAX_SLOW_MS = 60_000L;

  private final boolean slowEnabled;
  private final long slowThresholdMs;
  private final long slowThresholdNanos;
  private final Set<String> bestEffortComponents;

  public LoggingPolicy(long slowMs) {
    this(slowMs, Set.of());
  }

  /**
   * @param slowMs slow 판정 임계치(ms). 0 이하면 SLOW 판정 비활성
   * @param bestEffortComponents 실패가 호출자에게 전파되지 않는 컴포넌트. 실패를 WARN 한 줄로만 기록
   */
  public LoggingPolicy(long slowMs, Set<String> bestEffortComponents) {
    this.bestEffortComponents = Set.copyOf(bestEffortComponents);
    long clamped = Math.max(0L, Math.min(slowMs, MAX_SLOW_MS));

    this.slowThresholdMs = clamped;
    this.slowEnabled = clamped > 0;
    this.slowThresholdNanos = slowEnabled ? TimeUnit.MILLISECONDS.toNanos(clamped) : Long.MAX_VALUE;
  }

  @Override
  public void before(TaskContext context) {
    if (!log.isDebugEnabled()) return;
    log.debug("{} {}", TAG_START, TaskLogSupport.safeTaskName(context));
  }

  @Override
  public <T> void onSuccess(T ignored, long elapsedNanos, TaskContext context) {
    if (slowEnabled && elapsedNanos >= slowThresholdNanos) {
      log.info(
          "{} {}, elapsed={}, threshold={}ms",
          TAG_SLOW,
          TaskLogSupport.safeTaskName(context),
          formatDuration(elapsedNanos),
          slowThresholdMs);
      return;
    }

    if (!log.isDebugEnabled()) return;
    log.debug(
        "{} {}, elapsed={}",
        TAG_SUCCESS,
        TaskLogSupport.safeTaskName(context),
        formatDuration(elapsedNanos));
  }

  @Override
  public void onFailure(Throwable error, long elapsedNanos, TaskContext context) {
    String taskName = TaskLogSupport.safeTaskName(context);
    String elapsed = formatDuration(elapsedNanos);
    String errorType = (error != null) ? error.getClass().getSimpleName() : "UnknownError";

    if (error instanceof ClientBaseException) {
      log.debug(
          "{} {}, elapsed={}, errorType={}, message={}",
          TAG_FAILURE,
          taskName,
          elapsed,
          errorType,
          error.getMessage());
      return;
    }
    if (context != null && bestEffortComponents.contains(context.component())) {
      log.warn("{} {}, elapsed={}, errorType={}", TAG_FAILURE, taskName, elapsed, errorType);
      return;
    }
    log.error("{} {}, elapsed={}, errorType={}", TAG_FAILURE, taskName, elapsed, errorType, error);
  }

  @Override
  public void after(ExecutionOutcome outcome, long elapsedNanos, TaskContext context) {
    if (!log.isDebugEnabled()) return;
    log.debug(
        "{} {}, outcome={}, elapsed={}",
        TAG_AFTER,
        TaskLogSupport.safeTaskName(context),
        outcome,
        formatDuration(elapsedNanos));
  }

  public long slowThresholdMs() {
    return slowThresholdMs;
  }
}
