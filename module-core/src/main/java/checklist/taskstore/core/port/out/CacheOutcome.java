package checklist.taskstore.core.port.out;

import java.util.Objects;

/**
 * best-effort 캐시 쓰기/삭제 결과
 *
 * <p>캐시 실패는 호출자에게 예외로 전파되지 않고 이 값으로만 전달됩니다. 무시 여부는 받는 쪽에서 명시적으로 결정합니다.
 */
public record CacheOutcome(Status status, Throwable error) {

  public enum Status {
    APPLIED,
    SKIPPED,
    FAILED
  }

  private static final CacheOutcome APPLIED = new CacheOutcome(Status.APPLIED, null);
  private static final CacheOutcome SKIPPED = new CacheOutcome(Status.SKIPPED, null);

  public CacheOutcome {
    Objects.requireNonNull(status, "status");
  }

  public static CacheOutcome applied() {
    return APPLIED;
  }

  /** 캐시 비활성 상태 */
  public static CacheOutcome skipped() {
    return SKIPPED;
  }

  public static CacheOutcome failed(Throwable error) {
    return new CacheOutcome(Status.FAILED, error);
  }

  public boolean isFailed() {
    return status == Status.FAILED;
  }
}
