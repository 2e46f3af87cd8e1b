package checklist.taskstore.infrastructure.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * 원천 저장소 설정 ({@code task.store.*})
 *
 * <p>쿼리 타임아웃은 {@code spring.jdbc.template.query-timeout}, 커넥션 획득 타임아웃은 {@code
 * spring.datasource.hikari.connection-timeout}을 사용합니다.
 */
@Validated
@ConfigurationProperties(prefix = "task.store")
public class TaskStoreProperties {

  /** 이 시간 이상 걸린 저장소/캐시 호출은 [Task:SLOW] 로 기록 */
  @NotNull private Duration slowQueryThreshold = Duration.ofMillis(500);

  @NotNull @Valid private StartupRetry startupRetry = new StartupRetry();

  public Duration getSlowQueryThreshold() {
    return slowQueryThreshold;
  }

  public void setSlowQueryThreshold(Duration slowQueryThreshold) {
    this.slowQueryThreshold = slowQueryThreshold;
  }

  public StartupRetry getStartupRetry() {
    return startupRetry;
  }

  public void setStartupRetry(StartupRetry startupRetry) {
    this.startupRetry = startupRetry;
  }

  /** 기동 시 연결 재시도 (고정 간격) */
  public static class StartupRetry {

    @Min(1)
    @Max(100)
    private int maxAttempts = 10;

    @NotNull private Duration backoff = Duration.ofSeconds(5);

    public int getMaxAttempts() {
      return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
    }

    public Duration getBackoff() {
      return backoff;
    }

    public void setBackoff(Duration backoff) {
      this.backoff = backoff;
    }
  }
}
