package checklist.taskstore.infrastructure.executor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import checklist.taskstore.error.exception.InternalSystemException;
import checklist.taskstore.error.exception.TaskNotFoundException;
import checklist.taskstore.infrastructure.executor.function.ThrowingSupplier;
import checklist.taskstore.infrastructure.executor.policy.ExecutionPipeline;
import checklist.taskstore.infrastructure.executor.strategy.ExceptionTranslator;
import java.io.IOException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("DefaultLogicExecutor")
class DefaultLogicExecutorTest {

  @Mock private ExecutionPipeline pipeline;

  @Mock private ExceptionTranslator translator;

  private LogicExecutor executor;

  @BeforeEach
  void setUp() {
    executor = new DefaultLogicExecutor(pipeline, translator);
  }

  // ==================== Error Tests ====================

  @Test
  @DisplayName("Error 는 번역 없이 전파된다")
  void errorPropagatesUntranslated() throws Throwable {
    // Given
    TaskContext context = TaskContext.of("Test", "executeError");
    OutOfMemoryError error = new OutOfMemoryError("OOM");
    doAnswer(
            invocation -> {
              throw error;
            })
        .when(pipeline)
        .executeRaw(any(ThrowingSupplier.class), eq(context));

    // When & Then
    assertThatThrownBy(() -> executor.executeOrCatch(() -> "never", e -> "recovered", context))
        .isSameAs(error);
    verify(translator, never()).translate(any(), any());
  }

  // ==================== executeOrCatch() Tests ====================

  @Test
  @DisplayName("executeOrCatch() 복구 함수는 번역된 예외를 받는다")
  void executeOrCatchReceivesTranslatedException() throws Throwable {
    // Given
    TaskContext context = TaskContext.of("Test", "recover");
    IOException original = new IOException("io");
    InternalSystemException translated = new InternalSystemException("Test:recover", original);
    doAnswer(
            invocation -> {
              throw original;
            })
        .when(pipeline)
        .executeRaw(any(ThrowingSupplier.class), eq(context));
    when(translator.translate(original, context)).thenReturn(translated);
    AtomicReference<Throwable> received = new AtomicReference<>();

    // When
    String result =
        executor.executeOrCatch(
            () -> "never",
            e -> {
              received.set(e);
              return "recovered";
            },
            context);

    // Then
    assertThat(result).isEqualTo("recovered");
    assertThat(received.get()).isSameAs(translated);
  }

  @Test
  @DisplayName("executeOrDefault() 는 실패 시 기본값을 반환한다")
  void executeOrDefaultFallsBack() throws Throwable {
    // Given
    TaskContext context = TaskContext.of("Test", "default");
    IllegalStateException original = new IllegalStateException("boom");
    doAnswer(
            invocation -> {
              throw original;
            })
        .when(pipeline)
        .executeRaw(any(ThrowingSupplier.class), eq(context));
    when(translator.translate(original, context))
        .thenReturn(new InternalSystemException("Test:default", original));

    // When
    Integer result = executor.executeOrDefault(() -> 1, -1, context);

    // Then
    assertThat(result).isEqualTo(-1);
  }

  // ==================== executeWithTranslation() Tests ====================

  @Test
  @DisplayName("executeWithTranslation() 은 주입된 번역기 대신 전용 번역기를 사용한다")
  void executeWithTranslationUsesCustomTranslator() throws Throwable {
    // Given
    TaskContext context = TaskContext.of("TaskStore", "GetById", "42");
    RuntimeException original = new RuntimeException("empty");
    doAnswer(
            invocation -> {
              throw original;
            })
        .when(pipeline)
        .executeRaw(any(ThrowingSupplier.class), eq(context));
    ExceptionTranslator custom = (e, ctx) -> new TaskNotFoundException(ctx.dynamicValue());

    // When & Then
    assertThatThrownBy(() -> executor.executeWithTranslation(() -> "never", custom, context))
        .isInstanceOf(TaskNotFoundException.class)
        .hasMessageContaining("42");
    verify(translator, never()).translate(any(), any());
  }

  @Test
  @DisplayName("번역기가 던진 예외는 그 자체가 전파된다")
  void translatorFailureBecomesPrimary() throws Throwable {
    // Given
    TaskContext context = TaskContext.of("Test", "translatorFailure");
    IOException original = new IOException("io");
    IllegalArgumentException translatorFailure = new IllegalArgumentException("translator bug");
    doAnswer(
            invocation -> {
              throw original;
            })
        .when(pipeline)
        .executeRaw(any(ThrowingSupplier.class), eq(context));
    ExceptionTranslator broken =
        (e, ctx) -> {
          throw translatorFailure;
        };

    // When & Then
    assertThatThrownBy(() -> executor.executeWithTranslation(() -> "never", broken, context))
        .isSameAs(translatorFailure);
  }

  // ==================== Default Translator Tests ====================

  @Test
  @DisplayName("기본 번역기는 분류된 예외를 통과시키고 비동기 래퍼를 벗겨낸다")
  void defaultTranslatorPassesThroughAndUnwraps() {
    ExceptionTranslator defaults = ExceptionTranslator.defaultTranslator();
    TaskContext context = TaskContext.of("Test", "defaults");
    TaskNotFoundException notFound = new TaskNotFoundException("x");

    assertThat(defaults.translate(notFound, context)).isSameAs(notFound);
    assertThat(defaults.translate(new CompletionException(notFound), context)).isSameAs(notFound);
    assertThat(defaults.translate(new IOException("io"), context))
        .isInstanceOf(InternalSystemException.class)
        .extracting(e -> ((InternalSystemException) e).getTaskName())
        .isEqualTo("Test:defaults");
  }
}
