package checklist.taskstore.error.exception;

import checklist.taskstore.error.TaskErrorCode;
import checklist.taskstore.error.exception.base.ServerBaseException;
import lombok.Getter;

/**
 * 저장소 연결 실패 또는 타임아웃
 *
 * <p>요청 처리 중에는 재시도하지 않고 즉시 전파합니다. 재시도 여부는 호출자가 결정합니다.
 */
@Getter
public class StoreConnectionException extends ServerBaseException {

  private final String operation;

  public StoreConnectionException(String operation, Throwable cause) {
    super(TaskErrorCode.STORE_CONNECTION_FAILURE, cause);
    this.operation = operation;
  }
}
