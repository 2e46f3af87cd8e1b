package checklist.taskstore.infrastructure.executor.policy;

import checklist.taskstore.infrastructure.executor.TaskContext;
import checklist.taskstore.infrastructure.executor.function.ThrowingSupplier;
import java.util.List;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/**
 * ExecutionPolicy 를 순차 실행하는 파이프라인.
 *
 * <h3>보장</h3>
 *
 * <ul>
 *   <li><b>elapsedNanos 는 task.get() 구간만 측정</b> (정책 시간 제외)
 *   <li><b>BEFORE 는 등록 순서, AFTER 는 역순(LIFO)</b>
 *   <li><b>before() 성공한 정책만 after() 호출</b>
 *   <li><b>정책 훅은 관측 전용</b>: 훅의 non-Error 예외는 로그만 남기고 task 결과를 바꾸지 않음
 *   <li><b>task 예외는 원본 그대로 전파</b>: 번역은 LogicExecutor 책임
 * </ul>
 */
@Slf4j
public class ExecutionPipeline {

  private final List<ExecutionPolicy> policies;

  public ExecutionPipeline(List<ExecutionPolicy> policies) {
    Objects.requireNonNull(policies, "policies must not be null");
    this.policies = List.copyOf(policies);
  }

  public <T> T executeRaw(ThrowingSupplier<T> task, TaskContext context) throws Throwable {
    Objects.requireNonNull(task, "task must not be null");
    Objects.requireNonNull(context, "context must not be null");

    boolean[] entered = new boolean[policies.size()];
    for (int i = 0; i < policies.size(); i++) {
      entered[i] = invokeHook(policies.get(i), "before", context, p -> p.before(context));
    }

    long start = System.nanoTime();
    T result;
    try {
      result = task.get();
    } catch (Throwable t) {
      long elapsed = System.nanoTime() - start;
      for (int i = 0; i < policies.size(); i++) {
        if (entered[i]) {
          invokeHook(policies.get(i), "onFailure", context, p -> p.onFailure(t, elapsed, context));
        }
      }
      unwind(entered, ExecutionOutcome.FAILURE, elapsed, context);
      throw t;
    }

    long elapsed = System.nanoTime() - start;
    for (int i = 0; i < policies.size(); i++) {
      if (entered[i]) {
        invokeHook(
            policies.get(i), "onSuccess", context, p -> p.onSuccess(result, elapsed, context));
      }
    }
    unwind(entered, ExecutionOutcome.SUCCESS, elapsed, context);
    return result;
  }

  private void unwind(
      boolean[] entered, ExecutionOutcome outcome, long elapsed, TaskContext context) {
    for (int i = policies.size() - 1; i >= 0; i--) {
      if (entered[i]) {
        invokeHook(policies.get(i), "after", context, p -> p.after(outcome, elapsed, context));
      }
    }
  }

  private boolean invokeHook(
      ExecutionPolicy policy, String phase, TaskContext context, PolicyHook hook) {
    try {
      hook.invoke(policy);
      return true;
    } catch (Error e) {
      throw e;
    } catch (Exception e) {
      log.warn(
          "[Pipeline:HOOK_FAILURE] phase={}, policy={}, taskName={}",
          phase,
          policy.getClass().getSimpleName(),
          TaskLogSupport.safeTaskName(context),
          e);
      return false;
    }
  }

  @FunctionalInterface
  private interface PolicyHook {
    void invoke(ExecutionPolicy policy) throws Exception;
  }
}
