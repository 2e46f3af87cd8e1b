package checklist.taskstore.infrastructure.executor.policy;

/**
 * Task 실행 결과 (파이프라인 훅에 전달되는 성공/실패 구분)
 *
 * <p>정책 훅 자체의 실패와 무관하게 task 의 성공/실패만을 나타냅니다.
 */
public enum ExecutionOutcome {
  SUCCESS,
  FAILURE
}
