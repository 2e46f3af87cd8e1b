package checklist.taskstore.infrastructure.cache;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import checklist.taskstore.core.port.out.CacheLookup;
import checklist.taskstore.core.port.out.CacheOutcome;
import checklist.taskstore.core.port.out.TaskCachePort;
import checklist.taskstore.domain.model.task.Task;
import checklist.taskstore.domain.model.task.TaskId;
import checklist.taskstore.error.exception.TaskNotFoundException;
import checklist.taskstore.infrastructure.persistence.TaskRepositoryImpl;
import checklist.taskstore.infrastructure.persistence.TaskStoreExceptionTranslator;
import checklist.taskstore.support.EmbeddedTaskDatabase;
import checklist.taskstore.support.InMemoryTaskCache;
import checklist.taskstore.support.MutableClock;
import checklist.taskstore.support.TestLogicExecutors;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;

@DisplayName("CachedTaskRepository")
class CachedTaskRepositoryTest {

  private static final Instant START = Instant.parse("2024-05-01T09:00:00Z");
  private static final Duration ENTITY_TTL = Duration.ofMinutes(5);
  private static final Duration LIST_TTL = Duration.ofSeconds(60);

  private EmbeddedDatabase database;
  private TaskRepositoryImpl store;

  @BeforeEach
  void setUp() {
    database = EmbeddedTaskDatabase.create();
    store =
        new TaskRepositoryImpl(
            new JdbcTemplate(database),
            TestLogicExecutors.withoutPolicies(),
            new TaskStoreExceptionTranslator(),
            new MutableClock(START),
            TaskId::generate);
  }

  @AfterEach
  void tearDown() {
    database.shutdown();
  }

  // ==================== Cache-aside ====================

  @Nested
  @DisplayName("캐시 정상 동작")
  class CacheAside {

    private final InMemoryTaskCache cache = new InMemoryTaskCache();
    private CachedTaskRepository repository;

    @BeforeEach
    void setUp() {
      repository = new CachedTaskRepository(store, cache, ENTITY_TTL, LIST_TTL);
    }

    @Test
    @DisplayName("Create 는 단건 엔트리를 채우고 목록 엔트리를 무효화한다")
    void createPopulatesEntityAndInvalidatesList() {
      // Given
      cache.plantList(List.of());

      // When
      Task created = repository.create(Task.draft("Buy milk", null));

      // Then
      assertThat(cache.containsTask(created.id())).isTrue();
      assertThat(cache.ttlOf(TaskCacheKeys.taskKey(created.id()))).isEqualTo(ENTITY_TTL);
      assertThat(cache.hasTaskList()).isFalse();
    }

    @Test
    @DisplayName("캐시 히트면 원천 저장소를 조회하지 않는다")
    void hitSkipsStore() {
      // Given
      Task created = repository.create(Task.draft("Buy milk", null));
      Task planted = created.update(null, null, true);
      cache.plant(planted);

      // When
      Task found = repository.getById(created.id());

      // Then
      assertThat(found).isEqualTo(planted);
      assertThat(store.getById(created.id()).completed()).isFalse();
    }

    @Test
    @DisplayName("캐시 미스면 원천 저장소 결과로 단건 엔트리를 채운다")
    void missFillsEntity() {
      // Given
      Task created = store.create(Task.draft("Buy milk", null));
      assertThat(cache.containsTask(created.id())).isFalse();

      // When
      Task found = repository.getById(created.id());

      // Then
      assertThat(found).isEqualTo(created);
      assertThat(cache.containsTask(created.id())).isTrue();
    }

    @Test
    @DisplayName("List 는 목록 엔트리를 목록 TTL 로 채우고 이후 호출은 캐시에서 응답한다")
    void listFillsSnapshotWithListTtl() {
      // Given
      Task first = repository.create(Task.draft("first", null));

      // When
      List<Task> listed = repository.list();
      store.create(Task.draft("bypassing cache", null));

      // Then
      assertThat(listed).containsExactly(first);
      assertThat(cache.ttlOf(TaskCacheKeys.TASK_LIST_KEY)).isEqualTo(LIST_TTL);
      assertThat(repository.list()).containsExactly(first);
    }

    @Test
    @DisplayName("Update 후 List 는 변경된 값을 반영한다")
    void updateInvalidatesList() {
      // Given
      Task created = repository.create(Task.draft("Buy milk", null));
      repository.list();

      // When
      Task updated = repository.update(created.update(null, null, true));

      // Then
      assertThat(cache.hasTaskList()).isFalse();
      assertThat(repository.getById(created.id())).isEqualTo(updated);
      assertThat(repository.list()).containsExactly(updated);
    }

    @Test
    @DisplayName("Delete 는 단건 엔트리를 지우고 목록 엔트리를 무효화한다")
    void deleteEvictsEntityAndList() {
      // Given
      Task created = repository.create(Task.draft("Buy milk", null));
      repository.getById(created.id());
      repository.list();

      // When
      repository.deleteById(created.id());

      // Then
      assertThat(cache.containsTask(created.id())).isFalse();
      assertThat(cache.hasTaskList()).isFalse();
      assertThatThrownBy(() -> repository.getById(created.id()))
          .isInstanceOf(TaskNotFoundException.class);
      assertThat(repository.list()).isEmpty();
    }

    @Test
    @DisplayName("원천 저장소 오류는 그대로 전파되고 캐시는 건드리지 않는다")
    void storeErrorPropagatesWithoutTouchingCache() {
      // Given
      TaskId missing = TaskId.generate();
      cache.plantList(List.of());

      // When & Then
      assertThatThrownBy(() -> repository.getById(missing))
          .isInstanceOf(TaskNotFoundException.class);
      assertThatThrownBy(() -> repository.deleteById(missing))
          .isInstanceOf(TaskNotFoundException.class);
      assertThat(cache.containsTask(missing)).isFalse();
      assertThat(cache.hasTaskList()).isTrue();
    }
  }

  // ==================== Degraded ====================

  @Nested
  @DisplayName("캐시 장애")
  class Degraded {

    private Logger logger;
    private ListAppender<ILoggingEvent> appender;
    private CachedTaskRepository repository;

    @BeforeEach
    void setUp() {
      logger = (Logger) LoggerFactory.getLogger(CachedTaskRepository.class);
      appender = new ListAppender<>();
      appender.start();
      logger.addAppender(appender);
      repository = new CachedTaskRepository(store, new BrokenCache(), ENTITY_TTL, LIST_TTL);
    }

    @AfterEach
    void tearDown() {
      logger.detachAppender(appender);
      appender.stop();
    }

    @Test
    @DisplayName("모든 캐시 호출이 실패해도 저장소 결과는 그대로 반환된다")
    void cacheFailuresDoNotFailOperations() {
      // When
      Task created = repository.create(Task.draft("Buy milk", null));
      Task found = repository.getById(created.id());
      Task updated = repository.update(found.update(null, null, true));
      List<Task> listed = repository.list();
      repository.deleteById(created.id());

      // Then
      assertThat(found).isEqualTo(created);
      assertThat(listed).containsExactly(updated);
      assertThat(store.list()).isEmpty();
    }

    @Test
    @DisplayName("캐시 실패는 [TaskCache:DEGRADED] WARN 으로 원인 타입과 함께 기록된다")
    void cacheFailureIsLogged() {
      // When
      repository.create(Task.draft("Buy milk", null));

      // Then
      assertThat(appender.list)
          .isNotEmpty()
          .allSatisfy(event -> assertThat(event.getLevel()).isEqualTo(Level.WARN));
      assertThat(appender.list.get(0).getFormattedMessage())
          .contains("[TaskCache:DEGRADED]")
          .contains("operation=SetTask")
          .contains("SocketTimeoutException");
    }
  }

  @Test
  @DisplayName("0 이하 TTL 로는 생성할 수 없다")
  void rejectsNonPositiveTtl() {
    InMemoryTaskCache cache = new InMemoryTaskCache();

    assertThatThrownBy(() -> new CachedTaskRepository(store, cache, Duration.ZERO, LIST_TTL))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(
            () -> new CachedTaskRepository(store, cache, ENTITY_TTL, Duration.ofSeconds(-1)))
        .isInstanceOf(IllegalArgumentException.class);
  }

  /** 모든 호출이 타임아웃으로 실패하는 캐시 */
  private static final class BrokenCache implements TaskCachePort {

    private static CacheOutcome timeout() {
      return CacheOutcome.failed(
          new IllegalStateException("shard unreachable", new SocketTimeoutException("3000ms")));
    }

    @Override
    public CacheOutcome setTask(Task task, Duration ttl) {
      return timeout();
    }

    @Override
    public CacheLookup<Task> getTask(TaskId id) {
      return CacheLookup.failed(new SocketTimeoutException("3000ms"));
    }

    @Override
    public CacheOutcome deleteTask(TaskId id) {
      return timeout();
    }

    @Override
    public CacheOutcome setTaskList(List<Task> tasks, Duration ttl) {
      return timeout();
    }

    @Override
    public CacheLookup<List<Task>> getTaskList() {
      return CacheLookup.failed(new SocketTimeoutException("3000ms"));
    }

    @Override
    public CacheOutcome invalidateTaskList() {
      return timeout();
    }

    @Override
    public CacheOutcome ping() {
      return timeout();
    }

    @Override
    public boolean isEnabled() {
      return true;
    }

    @Override
    public void close() {}
  }
}
