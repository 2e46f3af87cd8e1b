package checklist.taskstore.infrastructure.cache;

import checklist.taskstore.core.port.out.CacheLookup;
import checklist.taskstore.core.port.out.CacheOutcome;
import checklist.taskstore.core.port.out.TaskCachePort;
import checklist.taskstore.domain.model.task.Task;
import checklist.taskstore.domain.model.task.TaskId;
import checklist.taskstore.infrastructure.executor.LogicExecutor;
import checklist.taskstore.infrastructure.executor.TaskContext;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RBucket;
import org.redisson.api.RedissonClient;
import org.redisson.client.codec.StringCodec;

/**
 * 샤딩된 Redis 태스크 캐시 (Redisson)
 *
 * <h3>동작</h3>
 *
 * <ul>
 *   <li>키마다 {@link ShardRouter}로 정확히 하나의 샤드를 선택 (샤드 간 복제/재시도 없음)
 *   <li>값은 {@link StringCodec} 버킷에 JSON 문자열로 저장
 *   <li>샤드가 없거나 close 이후에는 비활성: 쓰기 SKIPPED, 조회 DISABLED
 *   <li>어떤 실패도 예외로 던지지 않고 FAILED 결과로 반환
 * </ul>
 *
 * <p>샤드 클라이언트는 기동 시 한 번 생성되어 모든 요청이 공유합니다. 명령 타임아웃은 Redisson 설정을 따릅니다.
 */
@Slf4j
public class ShardedRedisTaskCache implements TaskCachePort {

  public static final String COMPONENT = "TaskCache";
  private static final String PING_KEY = "health-check";

  private final List<RedissonClient> shards;
  private final ShardRouter router;
  private final TaskCacheCodec codec;
  private final LogicExecutor executor;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  public ShardedRedisTaskCache(
      List<RedissonClient> shards, TaskCacheCodec codec, LogicExecutor executor) {
    this.shards = List.copyOf(shards);
    this.router = this.shards.isEmpty() ? null : new ShardRouter(this.shards.size());
    this.codec = Objects.requireNonNull(codec, "codec");
    this.executor = Objects.requireNonNull(executor, "executor");
  }

  public static ShardedRedisTaskCache disabled(TaskCacheCodec codec, LogicExecutor executor) {
    return new ShardedRedisTaskCache(List.of(), codec, executor);
  }

  @Override
  public boolean isEnabled() {
    return !shards.isEmpty() && !closed.get();
  }

  public int shardCount() {
    return shards.size();
  }

  // ==================== Single Task ====================

  @Override
  public CacheOutcome setTask(Task task, Duration ttl) {
    Objects.requireNonNull(task, "task");
    return write(
        "SetTask",
        TaskCacheKeys.taskKey(task.id()),
        bucket -> put(bucket, codec.encodeTask(task), ttl));
  }

  @Override
  public CacheLookup<Task> getTask(TaskId id) {
    Objects.requireNonNull(id, "id");
    return read("GetTask", TaskCacheKeys.taskKey(id), codec::decodeTask);
  }

  @Override
  public CacheOutcome deleteTask(TaskId id) {
    Objects.requireNonNull(id, "id");
    return write("DeleteTask", TaskCacheKeys.taskKey(id), RBucket::delete);
  }

  // ==================== Task List ====================

  @Override
  public CacheOutcome setTaskList(List<Task> tasks, Duration ttl) {
    Objects.requireNonNull(tasks, "tasks");
    return write(
        "SetTaskList",
        TaskCacheKeys.TASK_LIST_KEY,
        bucket -> put(bucket, codec.encodeList(tasks), ttl));
  }

  @Override
  public CacheLookup<List<Task>> getTaskList() {
    return read("GetTaskList", TaskCacheKeys.TASK_LIST_KEY, codec::decodeList);
  }

  @Override
  public CacheOutcome invalidateTaskList() {
    return write("InvalidateTaskList", TaskCacheKeys.TASK_LIST_KEY, RBucket::delete);
  }

  // ==================== Lifecycle ====================

  @Override
  public CacheOutcome ping() {
    if (!isEnabled()) {
      return CacheOutcome.skipped();
    }
    for (int i = 0; i < shards.size(); i++) {
      RedissonClient client = shards.get(i);
      CacheOutcome outcome =
          executor.executeOrCatch(
              () -> {
                client.getBucket(PING_KEY, StringCodec.INSTANCE).isExists();
                return CacheOutcome.applied();
              },
              CacheOutcome::failed,
              TaskContext.of(COMPONENT, "Ping", "shard-" + i));
      if (outcome.isFailed()) {
        return outcome;
      }
    }
    return CacheOutcome.applied();
  }

  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    for (int i = 0; i < shards.size(); i++) {
      RedissonClient client = shards.get(i);
      executor.executeOrDefault(
          () -> shutdown(client), null, TaskContext.of(COMPONENT, "Close", "shard-" + i));
    }
    log.info("[TaskCache] {} shard client(s) closed", shards.size());
  }

  // ==================== Internals ====================

  private CacheOutcome write(String operation, String key, BucketWrite action) {
    if (!isEnabled()) {
      return CacheOutcome.skipped();
    }
    int index = router.shardFor(key);
    RedissonClient client = shards.get(index);
    return executor.executeOrCatch(
        () -> {
          action.apply(client.getBucket(key, StringCodec.INSTANCE));
          return CacheOutcome.applied();
        },
        CacheOutcome::failed,
        context(operation, key, index));
  }

  private <T> CacheLookup<T> read(String operation, String key, JsonDecoder<T> decoder) {
    if (!isEnabled()) {
      return CacheLookup.disabled();
    }
    int index = router.shardFor(key);
    RedissonClient client = shards.get(index);
    return executor.executeOrCatch(
        () -> decode(client.<String>getBucket(key, StringCodec.INSTANCE).get(), decoder),
        CacheLookup::failed,
        context(operation, key, index));
  }

  private static <T> CacheLookup<T> decode(String json, JsonDecoder<T> decoder) throws Exception {
    if (json == null) {
      return CacheLookup.miss();
    }
    return CacheLookup.hit(decoder.decode(json));
  }

  private static void put(RBucket<String> bucket, String json, Duration ttl) {
    if (ttl == null || ttl.isNegative() || ttl.isZero()) {
      throw new IllegalArgumentException("cache ttl must be positive: " + ttl);
    }
    bucket.set(json, ttl);
  }

  private static Void shutdown(RedissonClient client) {
    if (!client.isShutdown()) {
      client.shutdown();
    }
    return null;
  }

  private static TaskContext context(String operation, String key, int shardIndex) {
    return TaskContext.of(COMPONENT, operation, key + "@shard-" + shardIndex);
  }

  @FunctionalInterface
  private interface BucketWrite {
    void apply(RBucket<String> bucket) throws Exception;
  }

  @FunctionalInterface
  private interface JsonDecoder<T> {
    T decode(String json) throws Exception;
  }
}
