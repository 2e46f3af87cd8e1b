package checklist.taskstore.infrastructure.persistence;

import checklist.taskstore.domain.model.task.Task;
import checklist.taskstore.domain.model.task.TaskId;
import checklist.taskstore.domain.repository.TaskRepository;
import checklist.taskstore.error.exception.InvalidTaskDataException;
import checklist.taskstore.error.exception.TaskNotFoundException;
import checklist.taskstore.infrastructure.executor.LogicExecutor;
import checklist.taskstore.infrastructure.executor.TaskContext;
import java.sql.Timestamp;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * 원천 저장소 어댑터 (JdbcTemplate)
 *
 * <h3>책임</h3>
 *
 * <ul>
 *   <li>tasks 테이블 CRUD
 *   <li>id / 타임스탬프 부여 (주입된 {@link Clock}, id 생성기)
 *   <li>드라이버 예외 → 분류 체계 번역 ({@link TaskStoreExceptionTranslator})
 * </ul>
 *
 * <p>모든 호출은 {@link LogicExecutor}를 거치므로 소요 시간 측정과 slow query 로깅이 자동 적용됩니다. 쿼리 타임아웃은
 * JdbcTemplate 설정({@code spring.jdbc.template.query-timeout})을 따르며 초과 시 ConnectionError 로 분류됩니다.
 */
@Slf4j
public class TaskRepositoryImpl implements TaskRepository {

  private static final String COMPONENT = "TaskStore";

  private static final String SELECT_COLUMNS =
      "SELECT id, title, description, completed, created_at, updated_at FROM tasks";
  private static final String INSERT_SQL =
      "INSERT INTO tasks (id, title, description, completed, created_at, updated_at)"
          + " VALUES (?, ?, ?, ?, ?, ?)";
  private static final String SELECT_BY_ID_SQL = SELECT_COLUMNS + " WHERE id = ?";
  private static final String UPDATE_SQL =
      "UPDATE tasks SET title = ?, description = ?, completed = ?, updated_at = ? WHERE id = ?";
  private static final String DELETE_SQL = "DELETE FROM tasks WHERE id = ?";
  private static final String LIST_SQL = SELECT_COLUMNS + " ORDER BY created_at DESC";

  private final JdbcTemplate jdbcTemplate;
  private final LogicExecutor executor;
  private final TaskStoreExceptionTranslator translator;
  private final Clock clock;
  private final Supplier<TaskId> idGenerator;

  public TaskRepositoryImpl(
      JdbcTemplate jdbcTemplate,
      LogicExecutor executor,
      TaskStoreExceptionTranslator translator,
      Clock clock,
      Supplier<TaskId> idGenerator) {
    this.jdbcTemplate = Objects.requireNonNull(jdbcTemplate, "jdbcTemplate");
    this.executor = Objects.requireNonNull(executor, "executor");
    this.translator = Objects.requireNonNull(translator, "translator");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator");
  }

  @Override
  public Task create(Task task) {
    Objects.requireNonNull(task, "task");
    Task persisted = task.assignIdentity(idGenerator.get(), clock.instant());

    return executor.executeWithTranslation(
        () -> insert(persisted), translator, TaskContext.of(COMPONENT, "Create", persisted.id()));
  }

  @Override
  public Task getById(TaskId id) {
    Objects.requireNonNull(id, "id");
    return executor.executeWithTranslation(
        () -> selectById(id), translator, TaskContext.of(COMPONENT, "GetById", id));
  }

  @Override
  public Task update(Task task) {
    Objects.requireNonNull(task, "task");
    if (task.isNew()) {
      throw new InvalidTaskDataException("task id is required for update");
    }
    return executor.executeWithTranslation(
        () -> updateRow(task), translator, TaskContext.of(COMPONENT, "Update", task.id()));
  }

  @Override
  public void deleteById(TaskId id) {
    Objects.requireNonNull(id, "id");
    executor.executeWithTranslation(
        () -> deleteRow(id), translator, TaskContext.of(COMPONENT, "Delete", id));
  }

  @Override
  public List<Task> list() {
    return executor.executeWithTranslation(
        () -> jdbcTemplate.query(LIST_SQL, TaskRowMapper.INSTANCE),
        translator,
        TaskContext.of(COMPONENT, "List"));
  }

  private Task insert(Task task) {
    jdbcTemplate.update(
        INSERT_SQL,
        task.id().toString(),
        task.title(),
        task.description(),
        task.completed(),
        Timestamp.from(task.createdAt()),
        Timestamp.from(task.updatedAt()));
    return task;
  }

  private Task selectById(TaskId id) {
    List<Task> rows = jdbcTemplate.query(SELECT_BY_ID_SQL, TaskRowMapper.INSTANCE, id.toString());
    if (rows.isEmpty()) {
      throw new TaskNotFoundException(id);
    }
    return rows.get(0);
  }

  private Task updateRow(Task task) {
    Task touched = task.touchedAt(clock.instant());
    int affected =
        jdbcTemplate.update(
            UPDATE_SQL,
            touched.title(),
            touched.description(),
            touched.completed(),
            Timestamp.from(touched.updatedAt()),
            touched.id().toString());
    if (affected == 0) {
      throw new TaskNotFoundException(task.id());
    }
    return selectById(task.id());
  }

  private Void deleteRow(TaskId id) {
    int affected = jdbcTemplate.update(DELETE_SQL, id.toString());
    if (affected == 0) {
      throw new TaskNotFoundException(id);
    }
    log.debug("Task deleted: {}", id);
    return null;
  }
}
