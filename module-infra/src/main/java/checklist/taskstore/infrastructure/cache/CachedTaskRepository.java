package checklist.taskstore.infrastructure.cache;

import checklist.taskstore.core.port.out.CacheLookup;
import checklist.taskstore.core.port.out.CacheOutcome;
import checklist.taskstore.core.port.out.TaskCachePort;
import checklist.taskstore.domain.model.task.Task;
import checklist.taskstore.domain.model.task.TaskId;
import checklist.taskstore.domain.repository.TaskRepository;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/**
 * Cache-aside 저장소 데코레이터
 *
 * <p>원천 저장소와 캐시를 같은 {@link TaskRepository} 계약 뒤에 조합합니다. 호출자는 캐시 유무를 알 수 없습니다.
 *
 * <h3>정책</h3>
 *
 * <ul>
 *   <li><b>읽기</b>: 캐시 조회 → 히트면 즉시 반환, 아니면 원천 저장소 조회 후 캐시 채움
 *   <li><b>쓰기</b>: 원천 저장소 먼저, 성공한 경우에만 단건 엔트리 갱신/삭제 + 목록 엔트리 무효화
 *   <li><b>캐시 실패</b>: WARN 로그만 남기고 미스와 동일하게 진행. 저장소 결과를 바꾸지 않음
 *   <li><b>저장소 실패</b>: 변환 없이 그대로 전파
 * </ul>
 *
 * <p>목록 스냅샷은 어떤 변경에도 통째로 무효화되므로 단건보다 짧은 TTL 로 채웁니다.
 */
@Slf4j
public class CachedTaskRepository implements TaskRepository {

  private final TaskRepository store;
  private final TaskCachePort cache;
  private final Duration entityTtl;
  private final Duration listTtl;

  public CachedTaskRepository(
      TaskRepository store, TaskCachePort cache, Duration entityTtl, Duration listTtl) {
    this.store = Objects.requireNonNull(store, "store");
    this.cache = Objects.requireNonNull(cache, "cache");
    this.entityTtl = requirePositive(entityTtl, "entityTtl");
    this.listTtl = requirePositive(listTtl, "listTtl");
  }

  @Override
  public Task create(Task task) {
    Task created = store.create(task);
    observe(cache.setTask(created, entityTtl), "SetTask", created.id());
    observe(cache.invalidateTaskList(), "InvalidateTaskList", TaskCacheKeys.TASK_LIST_KEY);
    return created;
  }

  @Override
  public Task getById(TaskId id) {
    CacheLookup<Task> cached = cache.getTask(id);
    if (cached.isHit()) {
      return cached.value();
    }
    observe(cached, "GetTask", id);

    Task task = store.getById(id);
    observe(cache.setTask(task, entityTtl), "SetTask", id);
    return task;
  }

  @Override
  public Task update(Task task) {
    Task updated = store.update(task);
    observe(cache.setTask(updated, entityTtl), "SetTask", updated.id());
    observe(cache.invalidateTaskList(), "InvalidateTaskList", TaskCacheKeys.TASK_LIST_KEY);
    return updated;
  }

  @Override
  public void deleteById(TaskId id) {
    store.deleteById(id);
    observe(cache.deleteTask(id), "DeleteTask", id);
    observe(cache.invalidateTaskList(), "InvalidateTaskList", TaskCacheKeys.TASK_LIST_KEY);
  }

  @Override
  public List<Task> list() {
    CacheLookup<List<Task>> cached = cache.getTaskList();
    if (cached.isHit()) {
      return cached.value();
    }
    observe(cached, "GetTaskList", TaskCacheKeys.TASK_LIST_KEY);

    List<Task> tasks = store.list();
    observe(cache.setTaskList(tasks, listTtl), "SetTaskList", TaskCacheKeys.TASK_LIST_KEY);
    return tasks;
  }

  private static void observe(CacheOutcome outcome, String operation, Object subject) {
    if (outcome.isFailed()) {
      log.warn(
          "[TaskCache:DEGRADED] operation={}, subject={}, errorType={}",
          operation,
          subject,
          rootCauseType(outcome.error()));
    }
  }

  private static void observe(CacheLookup<?> lookup, String operation, Object subject) {
    switch (lookup.status()) {
      case FAILED -> log.warn(
          "[TaskCache:DEGRADED] operation={}, subject={}, errorType={}, fallback=store",
          operation,
          subject,
          rootCauseType(lookup.error()));
      case MISS -> log.debug("[TaskCache:MISS] operation={}, subject={}", operation, subject);
      default -> {
        // HIT 은 호출 전에 반환, DISABLED 는 기록하지 않음
      }
    }
  }

  private static String rootCauseType(Throwable error) {
    if (error == null) {
      return "unknown";
    }
    Throwable root = error;
    while (root.getCause() != null && root.getCause() != root) {
      root = root.getCause();
    }
    return root.getClass().getSimpleName();
  }

  private static Duration requirePositive(Duration ttl, String name) {
    Objects.requireNonNull(ttl, name);
    if (ttl.isNegative() || ttl.isZero()) {
      throw new IllegalArgumentException(name + " must be positive: " + ttl);
    }
    return ttl;
  }
}
