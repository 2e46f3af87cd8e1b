package checklist.taskstore.domain.model.task;

import checklist.taskstore.error.exception.InvalidTaskDataException;
import java.util.Objects;
import java.util.UUID;

/**
 * 태스크 식별자 (Value Object)
 *
 * <p>생성 시 한 번 부여되며 재할당/재사용되지 않습니다.
 */
public record TaskId(UUID value) {

  public TaskId {
    Objects.requireNonNull(value, "TaskId value cannot be null");
  }

  public static TaskId of(UUID value) {
    return new TaskId(value);
  }

  /**
   * 외부 입력 문자열 파싱
   *
   * @throws InvalidTaskDataException UUID 형식이 아닌 경우
   */
  public static TaskId of(String value) {
    if (value == null || value.isBlank()) {
      throw new InvalidTaskDataException("task id is required");
    }
    try {
      return new TaskId(UUID.fromString(value.trim()));
    } catch (IllegalArgumentException e) {
      throw new InvalidTaskDataException("malformed task id: " + value, e);
    }
  }

  public static TaskId generate() {
    return new TaskId(UUID.randomUUID());
  }

  @Override
  public String toString() {
    return value.toString();
  }
}
