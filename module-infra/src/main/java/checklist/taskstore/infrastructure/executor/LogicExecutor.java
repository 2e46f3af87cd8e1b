package checklist.taskstore.infrastructure.executor;

import checklist.taskstore.infrastructure.executor.function.ThrowingSupplier;
import checklist.taskstore.infrastructure.executor.strategy.ExceptionTranslator;
import java.util.function.Function;

/**
 * 예외 처리 패턴을 추상화한 실행기
 *
 * <p>모든 저장소/캐시 호출은 이 실행기를 거쳐 실행되며, 파이프라인 정책(로깅, 메트릭)이 소요 시간과 결과를 기록합니다.
 *
 * <h3>지원 패턴</h3>
 *
 * <ol>
 *   <li><b>try-catch-recover</b> (예외를 값으로 복구) - {@link #executeOrCatch}
 *   <li><b>try-catch-return</b> (기본값 반환) - {@link #executeOrDefault}
 *   <li><b>다중 catch</b> (전용 번역기) - {@link #executeWithTranslation}
 * </ol>
 *
 * <h3>사용 예시</h3>
 *
 * <pre>{@code
 * return executor.executeWithTranslation(
 *     () -> selectById(id), translator, TaskContext.of("TaskStore", "GetById", id));
 * }</pre>
 */
public interface LogicExecutor {

  /**
   * 예외 발생 시 복구 함수 결과를 반환
   *
   * <p>복구 함수는 번역된 예외를 받습니다.
   */
  <T> T executeOrCatch(
      ThrowingSupplier<T> task, Function<Throwable, T> recovery, TaskContext context);

  <T> T executeOrDefault(ThrowingSupplier<T> task, T defaultValue, TaskContext context);

  /**
   * 전용 번역기로 예외를 도메인 예외로 변환하여 전파
   *
   * @throws RuntimeException 번역된 예외 (분류 체계 예외는 그대로)
   */
  <T> T executeWithTranslation(
      ThrowingSupplier<T> task, ExceptionTranslator translator, TaskContext context);
}
