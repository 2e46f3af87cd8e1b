package checklist.taskstore.infrastructure.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * 태스크 캐시 샤드 설정 ({@code task.cache.*})
 *
 * <h4>환경 변수</h4>
 *
 * <ul>
 *   <li>TASK_CACHE_ENABLED: 캐시 사용 여부
 *   <li>TASK_CACHE_NODES: 샤드 주소 목록 (콤마 구분, {@code host:port} 또는 {@code redis://host:port})
 *   <li>TASK_CACHE_PASSWORD / TASK_CACHE_DATABASE: 모든 샤드 공통 인증 정보와 논리 DB 번호
 *   <li>TASK_CACHE_ENTITY_TTL / TASK_CACHE_LIST_TTL: 단건/목록 TTL
 * </ul>
 *
 * <p>목록 스냅샷은 어떤 변경에도 통째로 무효화되므로 단건보다 짧은 TTL 을 사용합니다.
 */
@Validated
@ConfigurationProperties(prefix = "task.cache")
public class TaskCacheProperties {

  private boolean enabled = false;

  @NotNull private List<String> nodes = new ArrayList<>(List.of("localhost:6379"));

  private String password = "";

  @Min(0)
  @Max(15)
  private int database = 0;

  @NotNull private Duration entityTtl = Duration.ofSeconds(300);

  @NotNull private Duration listTtl = Duration.ofSeconds(60);

  /** 명령 응답 대기 시간. 초과 시 조회는 캐시 미스로 처리 */
  @NotNull private Duration timeout = Duration.ofSeconds(3);

  @NotNull private Duration connectTimeout = Duration.ofSeconds(5);

  /** 공백을 제거한 유효 샤드 주소. 비활성이면 빈 목록 */
  public List<String> activeNodes() {
    if (!enabled) {
      return List.of();
    }
    return nodes.stream().map(String::trim).filter(node -> !node.isEmpty()).toList();
  }

  @AssertTrue(message = "task.cache TTL 은 양수여야 합니다")
  public boolean isTtlPositive() {
    return entityTtl != null
        && listTtl != null
        && !entityTtl.isNegative()
        && !entityTtl.isZero()
        && !listTtl.isNegative()
        && !listTtl.isZero();
  }

  @AssertTrue(message = "task.cache.list-ttl 은 entity-ttl 보다 길 수 없습니다")
  public boolean isListTtlWithinEntityTtl() {
    return entityTtl == null || listTtl == null || listTtl.compareTo(entityTtl) <= 0;
  }

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public List<String> getNodes() {
    return nodes;
  }

  public void setNodes(List<String> nodes) {
    this.nodes = nodes;
  }

  public String getPassword() {
    return password;
  }

  public void setPassword(String password) {
    this.password = password;
  }

  public int getDatabase() {
    return database;
  }

  public void setDatabase(int database) {
    this.database = database;
  }

  public Duration getEntityTtl() {
    return entityTtl;
  }

  public void setEntityTtl(Duration entityTtl) {
    this.entityTtl = entityTtl;
  }

  public Duration getListTtl() {
    return listTtl;
  }

  public void setListTtl(Duration listTtl) {
    this.listTtl = listTtl;
  }

  public Duration getTimeout() {
    return timeout;
  }

  public void setTimeout(Duration timeout) {
    this.timeout = timeout;
  }

  public Duration getConnectTimeout() {
    return connectTimeout;
  }

  public void setConnectTimeout(Duration connectTimeout) {
    this.connectTimeout = connectTimeout;
  }
}
