package checklist.taskstore.infrastructure.executor.policy;

/** ExecutionPolicy 실행 순서 (낮을수록 먼저 before, after 는 역순) */
public final class PolicyOrder {

  public static final int LOGGING = 300;
  public static final int METRICS = 400;

  private PolicyOrder() {}
}
