package checklist.taskstore.error.exception.base;

import checklist.taskstore.error.ErrorCode;

/** 시스템 측 장애로 발생하는 예외 (5xx 계열). 원인 예외는 로그 용도로만 보존합니다. */
public abstract class ServerBaseException extends BaseException {

  protected ServerBaseException(ErrorCode errorCode, Throwable cause, Object... args) {
    super(errorCode, cause, args);
  }
}
