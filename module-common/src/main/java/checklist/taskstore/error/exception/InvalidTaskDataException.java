package checklist.taskstore.error.exception;

import checklist.taskstore.error.TaskErrorCode;
import checklist.taskstore.error.exception.base.ClientBaseException;

public class InvalidTaskDataException extends ClientBaseException {

  public InvalidTaskDataException(String reason) {
    super(TaskErrorCode.INVALID_TASK_DATA, reason);
  }

  public InvalidTaskDataException(String reason, Throwable cause) {
    super(TaskErrorCode.INVALID_TASK_DATA, cause, reason);
  }
}
