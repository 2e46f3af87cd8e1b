package checklist.taskstore.core.port.out;

import checklist.taskstore.domain.model.task.Task;
import checklist.taskstore.domain.model.task.TaskId;
import java.time.Duration;
import java.util.List;

/**
 * 태스크 스냅샷 캐시 포트
 *
 * <p>구현체는 어떤 메서드에서도 예외를 던지지 않습니다. 실패는 {@link CacheLookup} / {@link CacheOutcome}으로 반환됩니다.
 *
 * <h3>비활성 모드</h3>
 *
 * <ul>
 *   <li>쓰기/삭제: {@link CacheOutcome.Status#SKIPPED}
 *   <li>조회: {@link CacheLookup.Status#DISABLED}
 * </ul>
 */
public interface TaskCachePort extends AutoCloseable {

  CacheOutcome setTask(Task task, Duration ttl);

  CacheLookup<Task> getTask(TaskId id);

  CacheOutcome deleteTask(TaskId id);

  CacheOutcome setTaskList(List<Task> tasks, Duration ttl);

  CacheLookup<List<Task>> getTaskList();

  CacheOutcome invalidateTaskList();

  /** 모든 샤드 연결 확인 */
  CacheOutcome ping();

  boolean isEnabled();

  /** 모든 샤드 연결 해제. 여러 번 호출해도 안전 */
  @Override
  void close();
}
