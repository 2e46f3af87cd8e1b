package checklist.taskstore.domain.model.task;

import checklist.taskstore.error.exception.InvalidTaskDataException;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * 태스크 도메인 모델 (순수 도메인)
 *
 * <p>영속성 매핑은 module-infra 의 RowMapper 가 담당합니다.
 *
 * <h3>불변식</h3>
 *
 * <ul>
 *   <li>title 은 비어 있을 수 없음
 *   <li>{@code updatedAt >= createdAt}
 *   <li>id 는 저장 시점에 한 번 부여되고 이후 바뀌지 않음
 * </ul>
 *
 * <p>타임스탬프는 저장소가 보존하는 마이크로초 단위로 절삭됩니다.
 *
 * @param id 식별자 (저장 전 draft 는 null)
 * @param createdAt 생성 시각 (저장 전 draft 는 null)
 * @param updatedAt 마지막 수정 시각 (저장 전 draft 는 null)
 */
public record Task(
    TaskId id,
    String title,
    String description,
    boolean completed,
    Instant createdAt,
    Instant updatedAt) {

  public Task {
    if (title == null || title.isBlank()) {
      throw new InvalidTaskDataException("title is required");
    }
    if (createdAt != null && updatedAt != null && updatedAt.isBefore(createdAt)) {
      throw new InvalidTaskDataException("updatedAt must not precede createdAt");
    }
  }

  /** 저장 전 새 태스크 (id, 타임스탬프는 저장소가 부여) */
  public static Task draft(String title, String description) {
    return new Task(null, title, description, false, null, null);
  }

  /** 저장소/캐시 복원을 위한 정적 팩토리 */
  public static Task restore(
      TaskId id,
      String title,
      String description,
      boolean completed,
      Instant createdAt,
      Instant updatedAt) {
    return new Task(id, title, description, completed, createdAt, updatedAt);
  }

  public boolean isNew() {
    return id == null;
  }

  /** 저장 시점의 식별자와 생성 시각을 부여한 새 인스턴스 반환 */
  public Task assignIdentity(TaskId newId, Instant now) {
    Instant stamp = truncate(now);
    return new Task(newId, title, description, completed, stamp, stamp);
  }

  /**
   * 부분 수정된 새 인스턴스 반환
   *
   * <p>null 인자는 기존 값을 유지합니다. 수정 시각은 {@link #touchedAt(Instant)}로 저장소가 갱신합니다.
   */
  public Task update(String newTitle, String newDescription, Boolean newCompleted) {
    return new Task(
        id,
        newTitle != null ? newTitle : title,
        newDescription != null ? newDescription : description,
        newCompleted != null ? newCompleted : completed,
        createdAt,
        updatedAt);
  }

  /**
   * 수정 시각이 갱신된 새 인스턴스 반환
   *
   * <p>시계 해상도나 역행과 무관하게 결과는 항상 이전 {@code updatedAt} 보다 최소 1µs 이후입니다.
   */
  public Task touchedAt(Instant now) {
    Instant stamp = truncate(now);
    Instant previous = updatedAt != null ? updatedAt : createdAt;
    if (previous != null && !stamp.isAfter(previous)) {
      stamp = previous.plus(1, ChronoUnit.MICROS);
    }
    return new Task(id, title, description, completed, createdAt, stamp);
  }

  private static Instant truncate(Instant instant) {
    return instant.truncatedTo(ChronoUnit.MICROS);
  }
}
