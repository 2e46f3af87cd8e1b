package checklist.taskstore.infrastructure.cache;

import checklist.taskstore.infrastructure.config.TaskCacheProperties;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.config.Config;

/**
 * 샤드별 RedissonClient 생성
 *
 * <p>샤드마다 독립된 single-server 클라이언트를 만듭니다. 키가 복제되지 않으므로 Redisson 내부 재시도는 끄고, 실패는 즉시 호출자에게
 * 돌려줍니다. 하나라도 연결에 실패하면 이미 만든 클라이언트를 정리하고 예외를 그대로 던집니다 (기동 실패).
 */
@Slf4j
public class RedisShardClientFactory {

  private static final String REDIS_SCHEME = "redis://";
  private static final String REDIS_TLS_SCHEME = "rediss://";

  public List<RedissonClient> connect(TaskCacheProperties properties) {
    List<String> nodes = properties.activeNodes();
    List<RedissonClient> clients = new ArrayList<>(nodes.size());
    try {
      for (int i = 0; i < nodes.size(); i++) {
        String address = toAddress(nodes.get(i));
        clients.add(Redisson.create(buildConfig(address, properties)));
        log.info(
            "[TaskCache] shard {} connected: {} (db={})", i, address, properties.getDatabase());
      }
    } catch (RuntimeException e) {
      log.error("[TaskCache] shard connection failed after {} shard(s)", clients.size(), e);
      clients.forEach(RedissonClient::shutdown);
      throw e;
    }
    return clients;
  }

  Config buildConfig(String address, TaskCacheProperties properties) {
    Config config = new Config();
    config
        .useSingleServer()
        .setAddress(address)
        .setPassword(blankToNull(properties.getPassword()))
        .setDatabase(properties.getDatabase())
        .setTimeout((int) properties.getTimeout().toMillis())
        .setConnectTimeout((int) properties.getConnectTimeout().toMillis())
        .setRetryAttempts(0);
    return config;
  }

  static String toAddress(String node) {
    String trimmed = node.trim();
    if (trimmed.startsWith(REDIS_SCHEME) || trimmed.startsWith(REDIS_TLS_SCHEME)) {
      return trimmed;
    }
    return REDIS_SCHEME + trimmed;
  }

  private static String blankToNull(String value) {
    return (value == null || value.isBlank()) ? null : value;
  }
}
