package checklist.taskstore.error.dto;

import checklist.taskstore.error.ErrorCode;
import checklist.taskstore.error.ErrorStatus;
import checklist.taskstore.error.TaskErrorCode;
import checklist.taskstore.error.exception.base.BaseException;
import java.time.Instant;

/**
 * 전송 계층으로 내보내는 에러 응답
 *
 * <p>{@link #of(Throwable)}는 전 함수(total function)입니다. 분류 체계 밖의 예외는 모두 {@link
 * TaskErrorCode#INTERNAL_SERVER_ERROR}로 귀결되며 원본 메시지는 포함하지 않습니다.
 */
public record ErrorResponse(ErrorStatus status, String code, String message, Instant timestamp) {

  /** 비즈니스 예외: 포맷 인자가 반영된 메시지(예: 어떤 id가 없는지)를 전달합니다. */
  public static ErrorResponse from(BaseException e) {
    ErrorCode errorCode = e.getErrorCode();
    return new ErrorResponse(
        errorCode.getStatus(), errorCode.getCode(), e.getMessage(), Instant.now());
  }

  /** 고정 메시지: 상세 내용은 숨깁니다. */
  public static ErrorResponse from(ErrorCode errorCode) {
    return new ErrorResponse(
        errorCode.getStatus(), errorCode.getCode(), errorCode.getMessage(), Instant.now());
  }

  public static ErrorResponse of(Throwable error) {
    if (error instanceof BaseException be) {
      return from(be);
    }
    return from(TaskErrorCode.INTERNAL_SERVER_ERROR);
  }

  public int httpStatusCode() {
    return status.httpStatus().value();
  }
}
