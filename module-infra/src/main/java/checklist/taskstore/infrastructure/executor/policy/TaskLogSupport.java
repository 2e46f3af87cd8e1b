package checklist.taskstore.infrastructure.executor.policy;

import checklist.taskstore.infrastructure.executor.TaskContext;
import java.util.Locale;
import java.util.regex.Pattern;

/** 정책들이 공유하는 로깅 헬퍼 */
public final class TaskLogSupport {

  private static final String UNKNOWN = "unknown";
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private TaskLogSupport() {}

  /**
   * TaskContext 를 안전하게 문자열로 변환
   *
   * <p>로깅 실패가 본 실행 흐름에 영향을 주지 않도록 RuntimeException 만 격리합니다.
   */
  public static String safeTaskName(TaskContext context) {
    if (context == null) return UNKNOWN;

    try {
      String name = context.toTaskName();
      if (name == null) return UNKNOWN;

      // 제어문자/공백 정규화 (로그 파서 안정성)
      String normalized = WHITESPACE.matcher(name).replaceAll(" ").trim();
      return normalized.isEmpty() ? UNKNOWN : normalized;
    } catch (RuntimeException e) {
      return UNKNOWN + "(" + context.getClass().getSimpleName() + ")";
    }
  }

  public static String formatDuration(long elapsedNanos) {
    double millis = elapsedNanos / 1_000_000d;
    return String.format(Locale.ROOT, "%.3fms", millis);
  }
}
