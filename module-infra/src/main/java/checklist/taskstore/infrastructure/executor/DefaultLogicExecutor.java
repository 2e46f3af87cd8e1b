package checklist.taskstore.infrastructure.executor;

import checklist.taskstore.infrastructure.executor.function.ThrowingSupplier;
import checklist.taskstore.infrastructure.executor.policy.ExecutionPipeline;
import checklist.taskstore.infrastructure.executor.strategy.ExceptionTranslator;
import java.util.Objects;
import java.util.function.Function;
import lombok.RequiredArgsConstructor;

/**
 * ExecutionPipeline 기반 LogicExecutor 구현체
 *
 * <ul>
 *   <li><b>모든 메서드가 pipeline.executeRaw() 경유</b>: 정책(로깅/메트릭)이 빠짐없이 적용됨
 *   <li><b>Error 즉시 rethrow</b>: VirtualMachineError 등은 번역 없이 전파
 *   <li><b>번역기 실패 격리</b>: 번역기 자체가 던진 예외는 그 예외를 primary 로 삼음
 * </ul>
 */
@RequiredArgsConstructor
public class DefaultLogicExecutor implements LogicExecutor {

  private static final String UNEXPECTED_TRANSLATOR_FAILURE =
      "Translator failed with unexpected Throwable";

  private final ExecutionPipeline pipeline;
  private final ExceptionTranslator translator;

  @Override
  public <T> T executeOrCatch(
      ThrowingSupplier<T> task, Function<Throwable, T> recovery, TaskContext context) {
    Objects.requireNonNull(task, "task");
    Objects.requireNonNull(recovery, "recovery");
    Objects.requireNonNull(context, "context");

    try {
      return pipeline.executeRaw(task, context);
    } catch (Error e) {
      throw e;
    } catch (Throwable t) {
      return recovery.apply(translateSafe(translator, t, context));
    }
  }

  @Override
  public <T> T executeOrDefault(ThrowingSupplier<T> task, T defaultValue, TaskContext context) {
    return executeOrCatch(task, e -> defaultValue, context);
  }

  @Override
  public <T> T executeWithTranslation(
      ThrowingSupplier<T> task, ExceptionTranslator customTranslator, TaskContext context) {
    Objects.requireNonNull(task, "task");
    Objects.requireNonNull(customTranslator, "customTranslator");
    Objects.requireNonNull(context, "context");

    try {
      return pipeline.executeRaw(task, context);
    } catch (Error e) {
      throw e;
    } catch (Throwable t) {
      throw asUnchecked(translateSafe(customTranslator, t, context));
    }
  }

  private static Throwable translateSafe(
      ExceptionTranslator customTranslator, Throwable t, TaskContext context) {
    try {
      return customTranslator.translate(t, context);
    } catch (RuntimeException | Error ex) {
      return ex;
    } catch (Throwable unexpected) {
      return new IllegalStateException(UNEXPECTED_TRANSLATOR_FAILURE, unexpected);
    }
  }

  private static RuntimeException asUnchecked(Throwable t) {
    if (t instanceof Error e) throw e;
    if (t instanceof RuntimeException re) return re;
    return new IllegalStateException("Unexpected checked throwable", t);
  }
}
