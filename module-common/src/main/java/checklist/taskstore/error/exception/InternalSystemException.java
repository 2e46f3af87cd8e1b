package checklist.taskstore.error.exception;

import checklist.taskstore.error.TaskErrorCode;
import checklist.taskstore.error.exception.base.ServerBaseException;
import lombok.Getter;

/**
 * 분류되지 않은 시스템 예외 (catch-all)
 *
 * <p>외부 메시지는 고정 문구입니다. 어떤 작업에서 실패했는지는 {@link #getTaskName()}과 cause로만 추적합니다.
 */
@Getter
public class InternalSystemException extends ServerBaseException {

  private final String taskName;

  public InternalSystemException(String taskName, Throwable cause) {
    super(TaskErrorCode.INTERNAL_SERVER_ERROR, cause);
    this.taskName = taskName;
  }
}
