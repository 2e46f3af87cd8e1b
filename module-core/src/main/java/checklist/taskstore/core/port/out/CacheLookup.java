package checklist.taskstore.core.port.out;

import java.util.Objects;

/**
 * 캐시 조회 결과
 *
 * <p>MISS/DISABLED 는 "원천 저장소를 조회하라"는 정상 신호이고, FAILED 는 캐시 백엔드 장애입니다. 데코레이터는 셋 모두 미스로 처리하지만
 * 관측을 위해 구분해서 반환합니다.
 */
public record CacheLookup<T>(Status status, T value, Throwable error) {

  public enum Status {
    HIT,
    MISS,
    DISABLED,
    FAILED
  }

  public CacheLookup {
    Objects.requireNonNull(status, "status");
    if (status == Status.HIT) {
      Objects.requireNonNull(value, "hit value");
    }
  }

  public static <T> CacheLookup<T> hit(T value) {
    return new CacheLookup<>(Status.HIT, value, null);
  }

  public static <T> CacheLookup<T> miss() {
    return new CacheLookup<>(Status.MISS, null, null);
  }

  public static <T> CacheLookup<T> disabled() {
    return new CacheLookup<>(Status.DISABLED, null, null);
  }

  public static <T> CacheLookup<T> failed(Throwable error) {
    return new CacheLookup<>(Status.FAILED, null, error);
  }

  public boolean isHit() {
    return status == Status.HIT;
  }

  public boolean isFailed() {
    return status == Status.FAILED;
  }
}
