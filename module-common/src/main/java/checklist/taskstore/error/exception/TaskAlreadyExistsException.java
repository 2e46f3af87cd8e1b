package checklist.taskstore.error.exception;

import checklist.taskstore.error.TaskErrorCode;
import checklist.taskstore.error.exception.base.ClientBaseException;

/** 식별자 유일성 제약 위반 */
public class TaskAlreadyExistsException extends ClientBaseException {

  public TaskAlreadyExistsException(Object taskId, Throwable cause) {
    super(TaskErrorCode.TASK_ALREADY_EXISTS, cause, taskId);
  }
}
