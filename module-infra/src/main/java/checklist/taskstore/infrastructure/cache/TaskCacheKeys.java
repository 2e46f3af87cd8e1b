package checklist.taskstore.infrastructure.cache;

import checklist.taskstore.domain.model.task.TaskId;

/** 캐시 키 레이아웃 */
public final class TaskCacheKeys {

  public static final String TASK_KEY_PREFIX = "task:";

  /** 전체 목록 스냅샷. 모든 호출자가 공유하는 단일 키 */
  public static final String TASK_LIST_KEY = "tasks:list";

  private TaskCacheKeys() {}

  public static String taskKey(TaskId id) {
    return TASK_KEY_PREFIX + id;
  }
}
