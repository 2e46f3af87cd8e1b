package checklist.taskstore.infrastructure.executor.strategy;

import checklist.taskstore.error.exception.InternalSystemException;
import checklist.taskstore.error.exception.base.BaseException;
import checklist.taskstore.infrastructure.executor.TaskContext;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/** 특정 예외를 도메인 예외로 변환하는 전략 */
@FunctionalInterface
public interface ExceptionTranslator {

  /**
   * @param e 원본 예외
   * @param context 작업 컨텍스트
   * @return 변환된 RuntimeException
   */
  RuntimeException translate(Throwable e, TaskContext context);

  /**
   * Error guard + async unwrap + BaseException pass-through 를 선행 적용하는 Decorator
   *
   * <ol>
   *   <li>Error → 즉시 rethrow
   *   <li>CompletionException/ExecutionException → 원본으로 unwrap
   *   <li>이미 분류된 예외(BaseException)는 그대로 반환
   *   <li>InterruptedException 은 인터럽트 플래그 복원
   *   <li>나머지는 내부 translator 에 위임
   * </ol>
   */
  static ExceptionTranslator withErrorGuardAndUnwrap(ExceptionTranslator inner) {
    return (e, context) -> {
      if (e instanceof Error err) {
        throw err;
      }
      Throwable unwrapped = unwrap(e);
      if (unwrapped instanceof BaseException be) {
        return be;
      }
      if (unwrapped instanceof InterruptedException) {
        Thread.currentThread().interrupt();
      }
      return inner.translate(unwrapped, context);
    };
  }

  /** 분류되지 않은 예외는 모두 InternalSystemException */
  static ExceptionTranslator defaultTranslator() {
    return withErrorGuardAndUnwrap(
        (unwrapped, context) -> new InternalSystemException(context.toTaskName(), unwrapped));
  }

  private static Throwable unwrap(Throwable e) {
    Throwable current = e;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }
}
