package checklist.taskstore.infrastructure.persistence;

import checklist.taskstore.domain.model.task.Task;
import checklist.taskstore.domain.model.task.TaskId;
import java.sql.ResultSet;
import java.sql.SQLException;
import org.springframework.jdbc.core.RowMapper;

/** tasks 테이블 행 → Task 도메인 모델 */
public class TaskRowMapper implements RowMapper<Task> {

  public static final TaskRowMapper INSTANCE = new TaskRowMapper();

  @Override
  public Task mapRow(ResultSet rs, int rowNum) throws SQLException {
    return Task.restore(
        TaskId.of(rs.getString("id")),
        rs.getString("title"),
        rs.getString("description"),
        rs.getBoolean("completed"),
        rs.getTimestamp("created_at").toInstant(),
        rs.getTimestamp("updated_at").toInstant());
  }
}
