package checklist.taskstore.infrastructure.cache;

import checklist.taskstore.domain.model.task.Task;
import checklist.taskstore.domain.model.task.TaskId;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

/** 캐시에 저장되는 JSON 스냅샷 */
record TaskSnapshot(
    @JsonProperty("id") String id,
    @JsonProperty("title") String title,
    @JsonProperty("description") String description,
    @JsonProperty("completed") boolean completed,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("updated_at") Instant updatedAt) {

  static TaskSnapshot from(Task task) {
    return new TaskSnapshot(
        task.id().toString(),
        task.title(),
        task.description(),
        task.completed(),
        task.createdAt(),
        task.updatedAt());
  }

  Task toDomain() {
    return Task.restore(TaskId.of(id), title, description, completed, createdAt, updatedAt);
  }
}
