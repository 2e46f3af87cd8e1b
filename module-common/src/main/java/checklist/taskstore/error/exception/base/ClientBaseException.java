package checklist.taskstore.error.exception.base;

import checklist.taskstore.error.ErrorCode;

/**
 * 호출자의 요청 자체가 잘못되었을 때 발생하는 예외 (4xx 계열)
 *
 * <p>NotFound 처럼 정상적으로 예상 가능한 결과도 포함합니다. 재시도 대상이 아닙니다.
 */
public abstract class ClientBaseException extends BaseException {

  protected ClientBaseException(ErrorCode errorCode, Object... args) {
    super(errorCode, args);
  }

  protected ClientBaseException(ErrorCode errorCode, Throwable cause, Object... args) {
    super(errorCode, cause, args);
  }
}
