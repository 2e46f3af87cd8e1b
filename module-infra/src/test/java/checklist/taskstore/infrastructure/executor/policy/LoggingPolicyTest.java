package checklist.taskstore.infrastructure.executor.policy;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import checklist.taskstore.error.exception.StoreConnectionException;
import checklist.taskstore.error.exception.TaskNotFoundException;
import checklist.taskstore.infrastructure.executor.TaskContext;
import java.net.SocketTimeoutException;
import java.sql.SQLException;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

@DisplayName("LoggingPolicy")
class LoggingPolicyTest {

  private static final TaskContext CONTEXT = TaskContext.of("TaskStore", "List");

  private final LoggingPolicy policy = new LoggingPolicy(500);

  private Logger logger;
  private ListAppender<ILoggingEvent> appender;
  private Level originalLevel;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(LoggingPolicy.class);
    originalLevel = logger.getLevel();
    logger.setLevel(Level.DEBUG);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
  }

  @AfterEach
  void tearDown() {
    logger.detachAppender(appender);
    logger.setLevel(originalLevel);
    appender.stop();
  }

  @Test
  @DisplayName("임계치 이상 걸린 호출은 [Task:SLOW] INFO 로 기록된다")
  void slowCallLoggedAtInfo() {
    // When
    policy.onSuccess("ok", TimeUnit.MILLISECONDS.toNanos(750), CONTEXT);

    // Then
    assertThat(appender.list).hasSize(1);
    ILoggingEvent event = appender.list.get(0);
    assertThat(event.getLevel()).isEqualTo(Level.INFO);
    assertThat(event.getFormattedMessage())
        .contains(TaskLogTags.TAG_SLOW)
        .contains("TaskStore:List")
        .contains("threshold=500ms");
  }

  @Test
  @DisplayName("임계치 미만은 [Task:SUCCESS] DEBUG 로 기록된다")
  void fastCallLoggedAtDebug() {
    // When
    policy.onSuccess("ok", TimeUnit.MILLISECONDS.toNanos(12), CONTEXT);

    // Then
    assertThat(appender.list).hasSize(1);
    ILoggingEvent event = appender.list.get(0);
    assertThat(event.getLevel()).isEqualTo(Level.DEBUG);
    assertThat(event.getFormattedMessage()).contains(TaskLogTags.TAG_SUCCESS);
  }

  @Test
  @DisplayName("NotFound 같은 호출자 책임 실패는 stacktrace 없이 DEBUG 로 기록된다")
  void clientFailureLoggedWithoutStackTrace() {
    // When
    policy.onFailure(new TaskNotFoundException("42"), 1_000L, CONTEXT);

    // Then
    ILoggingEvent event = appender.list.get(0);
    assertThat(event.getLevel()).isEqualTo(Level.DEBUG);
    assertThat(event.getThrowableProxy()).isNull();
    assertThat(event.getFormattedMessage()).contains("TaskNotFoundException");
  }

  @Test
  @DisplayName("시스템 실패는 stacktrace 와 함께 ERROR 로 기록된다")
  void serverFailureLoggedAtError() {
    // When
    StoreConnectionException error =
        new StoreConnectionException("List", new SQLException("refused", "08001"));
    policy.onFailure(error, 1_000L, CONTEXT);

    // Then
    ILoggingEvent event = appender.list.get(0);
    assertThat(event.getLevel()).isEqualTo(Level.ERROR);
    assertThat(event.getThrowableProxy()).isNotNull();
    assertThat(event.getFormattedMessage()).contains(TaskLogTags.TAG_FAILURE);
  }

  @Test
  @DisplayName("best-effort 컴포넌트 실패는 stacktrace 없이 WARN 한 줄로 기록된다")
  void bestEffortFailureLoggedAtWarn() {
    // Given
    LoggingPolicy cacheAware = new LoggingPolicy(500, Set.of("TaskCache"));
    TaskContext cacheContext = TaskContext.of("TaskCache", "GetTask", "task:1@shard-0");

    // When
    cacheAware.onFailure(new SocketTimeoutException("3000ms"), 1_000L, cacheContext);
    cacheAware.onFailure(new IllegalStateException("boom"), 1_000L, CONTEXT);

    // Then
    assertThat(appender.list).hasSize(2);
    ILoggingEvent cacheEvent = appender.list.get(0);
    assertThat(cacheEvent.getLevel()).isEqualTo(Level.WARN);
    assertThat(cacheEvent.getThrowableProxy()).isNull();
    assertThat(cacheEvent.getFormattedMessage())
        .contains(TaskLogTags.TAG_FAILURE)
        .contains("SocketTimeoutException");
    assertThat(appender.list.get(1).getLevel()).isEqualTo(Level.ERROR);
  }

  @Test
  @DisplayName("0 이하 임계치는 SLOW 판정을 끈다")
  void nonPositiveThresholdDisablesSlow() {
    // Given
    LoggingPolicy disabled = new LoggingPolicy(0);

    // When
    disabled.onSuccess("ok", TimeUnit.SECONDS.toNanos(30), CONTEXT);

    // Then
    assertThat(appender.list)
        .noneMatch(event -> event.getFormattedMessage().contains(TaskLogTags.TAG_SLOW));
  }
}
