package checklist.taskstore.domain.repository;

import checklist.taskstore.domain.model.task.Task;
import checklist.taskstore.domain.model.task.TaskId;
import java.util.List;

/**
 * 태스크 저장소 계약
 *
 * <p>호출자는 캐시 적용 여부를 알 수 없습니다. 구현체는 원천 저장소 어댑터와, 이를 감싸는 cache-aside 데코레이터 두 가지입니다.
 *
 * <h3>실패 계약</h3>
 *
 * <ul>
 *   <li>{@code TaskNotFoundException}: 존재하지 않는 id 조회/수정/삭제
 *   <li>{@code TaskAlreadyExistsException}: 식별자 유일성 위반
 *   <li>{@code TaskConstraintViolationException}: 그 외 무결성 제약 위반
 *   <li>{@code InvalidTaskDataException}: 저장소가 거부한 잘못된 입력
 *   <li>{@code StoreConnectionException}: 저장소 연결 실패 또는 타임아웃
 *   <li>{@code InternalSystemException}: 분류되지 않은 실패
 * </ul>
 */
public interface TaskRepository {

  /** id 와 타임스탬프를 부여하고 저장한 결과를 반환 */
  Task create(Task task);

  Task getById(TaskId id);

  /** title, description, completed 를 전체 교체하고 updatedAt 을 갱신 */
  Task update(Task task);

  /** 멱등하지 않음: 두 번째 삭제는 NotFound */
  void deleteById(TaskId id);

  /** createdAt 내림차순. 빈 목록은 정상 결과 */
  List<Task> list();
}
