package checklist.taskstore.infrastructure.persistence;

import checklist.taskstore.infrastructure.executor.LogicExecutor;
import checklist.taskstore.infrastructure.executor.TaskContext;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;

/** 저장소 연결 확인 ({@code SELECT 1}) */
@RequiredArgsConstructor
public class TaskStoreHealthChecker {

  private static final String PING_SQL = "SELECT 1";

  private final JdbcTemplate jdbcTemplate;
  private final LogicExecutor executor;
  private final TaskStoreExceptionTranslator translator;

  /**
   * @throws checklist.taskstore.error.exception.StoreConnectionException 연결 실패 또는 타임아웃
   */
  public void check() {
    executor.executeWithTranslation(
        () -> jdbcTemplate.queryForObject(PING_SQL, Integer.class),
        translator,
        TaskContext.of("TaskStore", "Ping"));
  }
}
