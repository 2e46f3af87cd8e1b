package checklist.taskstore.error.exception;

import checklist.taskstore.error.TaskErrorCode;
import checklist.taskstore.error.exception.base.ClientBaseException;
import lombok.Getter;

/** NOT NULL, CHECK, FK 등 유일성 외의 무결성 제약 위반 */
@Getter
public class TaskConstraintViolationException extends ClientBaseException {

  private final String operation;

  public TaskConstraintViolationException(String operation, Throwable cause) {
    super(TaskErrorCode.CONSTRAINT_VIOLATION, cause);
    this.operation = operation;
  }
}
