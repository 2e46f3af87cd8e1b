package checklist.taskstore.infrastructure.executor.policy;

import checklist.taskstore.infrastructure.executor.TaskContext;

/**
 * 작업 실행 전후에 끼어드는 관측 훅
 *
 * <p>훅에서 발생한 예외(Error 제외)는 파이프라인이 로그만 남기고 삼킵니다. 정책은 task 결과를 바꿀 수 없습니다.
 */
public interface ExecutionPolicy {

  default void before(TaskContext context) throws Exception {}

  default <T> void onSuccess(T result, long elapsedNanos, TaskContext context) throws Exception {}

  default void onFailure(Throwable error, long elapsedNanos, TaskContext context)
      throws Exception {}

  default void after(ExecutionOutcome outcome, long elapsedNanos, TaskContext context)
      throws Exception {}
}
