package checklist.taskstore.error.exception;

import checklist.taskstore.error.TaskErrorCode;
import checklist.taskstore.error.exception.base.ClientBaseException;

public class TaskNotFoundException extends ClientBaseException {

  public TaskNotFoundException(Object taskId) {
    super(TaskErrorCode.TASK_NOT_FOUND, taskId);
  }
}
