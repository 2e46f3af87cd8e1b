package checklist.taskstore.error;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 태스크 저장소 에러 분류 체계 (closed set)
 *
 * <p>저장소/캐시 어느 계층에서 발생한 실패든 이 여섯 가지 중 하나로 귀결됩니다.
 *
 * <ul>
 *   <li>T0xx: 호출자 책임 (4xx 계열)
 *   <li>S0xx: 시스템 책임 (5xx 계열)
 * </ul>
 *
 * <p>{@link #INTERNAL_SERVER_ERROR}와 {@link #STORE_CONNECTION_FAILURE}는 포맷 인자를 받지 않습니다. 쿼리 문자열이나 샤드
 * 주소 같은 내부 정보는 외부 메시지에 포함되지 않고 로그에만 남습니다.
 */
@Getter
@RequiredArgsConstructor
public enum TaskErrorCode implements ErrorCode {

  // === Client Errors (4xx) ===
  TASK_NOT_FOUND("T001", "존재하지 않는 태스크입니다 (id: %s)", ErrorStatus.NOT_FOUND),
  TASK_ALREADY_EXISTS("T002", "이미 존재하는 태스크입니다 (id: %s)", ErrorStatus.ALREADY_EXISTS),
  CONSTRAINT_VIOLATION("T003", "데이터 무결성 제약 조건을 위반했습니다", ErrorStatus.FAILED_PRECONDITION),
  INVALID_TASK_DATA("T004", "잘못된 태스크 데이터입니다: %s", ErrorStatus.INVALID_ARGUMENT),

  // === Server Errors (5xx) ===
  STORE_CONNECTION_FAILURE("S001", "저장소에 일시적으로 연결할 수 없습니다", ErrorStatus.UNAVAILABLE),
  INTERNAL_SERVER_ERROR("S002", "서버 내부 오류가 발생했습니다", ErrorStatus.INTERNAL);

  private final String code;
  private final String message;
  private final ErrorStatus status;
}
