package checklist.taskstore.infrastructure.executor.policy;

import checklist.taskstore.infrastructure.executor.TaskContext;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.springframework.core.annotation.Order;

/**
 * 작업 소요 시간을 Micrometer Timer 로 기록하는 정책
 *
 * <p>태그는 component, operation, outcome 만 사용합니다. dynamicValue(태스크 id 등)는 카디널리티 폭증을 막기 위해 제외합니다.
 */
@Order(PolicyOrder.METRICS)
public class MetricsPolicy implements ExecutionPolicy {

  public static final String METRIC_NAME = "taskstore.operation";

  private final MeterRegistry meterRegistry;

  public MetricsPolicy(MeterRegistry meterRegistry) {
    this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry");
  }

  @Override
  public void after(ExecutionOutcome outcome, long elapsedNanos, TaskContext context) {
    Timer.builder(METRIC_NAME)
        .tag("component", context.component())
        .tag("operation", context.operation())
        .tag("outcome", outcome.name().toLowerCase())
        .register(meterRegistry)
        .record(elapsedNanos, TimeUnit.NANOSECONDS);
  }
}
