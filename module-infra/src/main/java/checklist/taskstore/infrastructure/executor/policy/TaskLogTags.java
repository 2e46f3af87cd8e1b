package checklist.taskstore.infrastructure.executor.policy;

/** 실행 파이프라인 로그 태그. 로그 수집기가 이 접두어로 필터링합니다. */
public final class TaskLogTags {

  public static final String TAG_START = "[Task:START]";
  public static final String TAG_SUCCESS = "[Task:SUCCESS]";
  public static final String TAG_SLOW = "[Task:SLOW]";
  public static final String TAG_FAILURE = "[Task:FAILURE]";
  public static final String TAG_AFTER = "[Task:AFTER]";

  private TaskLogTags() {}
}
