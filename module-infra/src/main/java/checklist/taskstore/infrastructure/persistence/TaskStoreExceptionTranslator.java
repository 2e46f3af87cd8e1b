package checklist.taskstore.infrastructure.persistence;

import checklist.taskstore.error.exception.InternalSystemException;
import checklist.taskstore.error.exception.InvalidTaskDataException;
import checklist.taskstore.error.exception.StoreConnectionException;
import checklist.taskstore.error.exception.TaskAlreadyExistsException;
import checklist.taskstore.error.exception.TaskConstraintViolationException;
import checklist.taskstore.error.exception.TaskNotFoundException;
import checklist.taskstore.infrastructure.executor.TaskContext;
import checklist.taskstore.infrastructure.executor.strategy.ExceptionTranslator;
import java.sql.SQLException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.EmptyResultDataAccessException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessResourceException;
import org.springframework.dao.TypeMismatchDataAccessException;

/**
 * 저장소 예외 → 태스크 에러 분류 체계 번역기
 *
 * <p>드라이버 수준 정보를 들여다보는 유일한 지점입니다. Spring {@code DataAccessException} 타입 계층과 SQLState 클래스로만
 * 분류하며, 에러 메시지 문자열은 절대 비교하지 않습니다.
 *
 * <h3>분류 순서</h3>
 *
 * <ol>
 *   <li>DuplicateKeyException → AlreadyExists
 *   <li>SQLState 22xxx (data exception) → InvalidData
 *   <li>그 외 DataIntegrityViolationException → ConstraintViolation
 *   <li>TypeMismatchDataAccessException → InvalidData
 *   <li>연결/타임아웃 계열, SQLState 08xxx → ConnectionError
 *   <li>EmptyResultDataAccessException → NotFound
 *   <li>나머지 → Internal
 * </ol>
 *
 * <p>AlreadyExists / NotFound 메시지에는 {@link TaskContext#dynamicValue()}의 태스크 id 가 사용됩니다.
 */
public class TaskStoreExceptionTranslator implements ExceptionTranslator {

  private static final String SQL_STATE_DATA_EXCEPTION = "22";
  private static final String SQL_STATE_CONNECTION_EXCEPTION = "08";

  private final ExceptionTranslator delegate =
      ExceptionTranslator.withErrorGuardAndUnwrap(this::classify);

  @Override
  public RuntimeException translate(Throwable e, TaskContext context) {
    return delegate.translate(e, context);
  }

  private RuntimeException classify(Throwable e, TaskContext context) {
    String sqlStateClass = sqlStateClass(e);

    if (e instanceof DuplicateKeyException) {
      return new TaskAlreadyExistsException(context.dynamicValue(), e);
    }
    if (e instanceof DataIntegrityViolationException
        && SQL_STATE_DATA_EXCEPTION.equals(sqlStateClass)) {
      return new InvalidTaskDataException("rejected by store", e);
    }
    if (e instanceof DataIntegrityViolationException) {
      return new TaskConstraintViolationException(context.operation(), e);
    }
    if (e instanceof TypeMismatchDataAccessException) {
      return new InvalidTaskDataException("type mismatch", e);
    }
    if (isConnectionFailure(e, sqlStateClass)) {
      return new StoreConnectionException(context.operation(), e);
    }
    if (e instanceof EmptyResultDataAccessException) {
      return new TaskNotFoundException(context.dynamicValue());
    }
    return new InternalSystemException(context.toTaskName(), e);
  }

  private static boolean isConnectionFailure(Throwable e, String sqlStateClass) {
    return e instanceof DataAccessResourceFailureException
        || e instanceof TransientDataAccessResourceException
        || e instanceof QueryTimeoutException
        || e instanceof RecoverableDataAccessException
        || SQL_STATE_CONNECTION_EXCEPTION.equals(sqlStateClass);
  }

  /** cause 체인에서 처음 만나는 SQLException 의 SQLState 앞 두 자리 */
  private static String sqlStateClass(Throwable e) {
    Throwable current = e;
    while (current != null) {
      if (current instanceof SQLException sql && sql.getSQLState() != null) {
        String state = sql.getSQLState();
        return state.length() >= 2 ? state.substring(0, 2) : state;
      }
      if (current.getCause() == current) {
        break;
      }
      current = current.getCause();
    }
    return null;
  }
}
