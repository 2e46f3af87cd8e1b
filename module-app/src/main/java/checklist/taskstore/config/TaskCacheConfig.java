package checklist.taskstore.config;

import checklist.taskstore.core.port.out.CacheOutcome;
import checklist.taskstore.core.port.out.TaskCachePort;
import checklist.taskstore.domain.repository.TaskRepository;
import checklist.taskstore.infrastructure.cache.CachedTaskRepository;
import checklist.taskstore.infrastructure.cache.RedisShardClientFactory;
import checklist.taskstore.infrastructure.cache.ShardedRedisTaskCache;
import checklist.taskstore.infrastructure.cache.TaskCacheCodec;
import checklist.taskstore.infrastructure.config.TaskCacheProperties;
import checklist.taskstore.infrastructure.executor.LogicExecutor;
import checklist.taskstore.infrastructure.persistence.TaskRepositoryImpl;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RedissonClient;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/**
 * 태스크 캐시 설정
 *
 * <h3>기동 동작</h3>
 *
 * <ul>
 *   <li>{@code task.cache.enabled=false} 이거나 유효 노드가 없으면 비활성 캐시 (Redis 연결 없음)
 *   <li>활성이면 샤드마다 클라이언트를 만들고 한 번씩 ping. 하나라도 실패하면 기동 실패
 *   <li>종료 시 모든 샤드 클라이언트 shutdown
 * </ul>
 *
 * <p>애플리케이션 코드는 {@link Primary} {@link TaskRepository}(cache-aside 데코레이터)만 주입받습니다.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(TaskCacheProperties.class)
public class TaskCacheConfig {

  @Bean
  public TaskCacheCodec taskCacheCodec() {
    return new TaskCacheCodec();
  }

  @Bean
  public RedisShardClientFactory redisShardClientFactory() {
    return new RedisShardClientFactory();
  }

  @Bean(destroyMethod = "close")
  public TaskCachePort taskCache(
      TaskCacheProperties properties,
      RedisShardClientFactory clientFactory,
      TaskCacheCodec codec,
      LogicExecutor executor) {
    if (properties.activeNodes().isEmpty()) {
      log.info("[TaskCache] caching disabled (enabled={})", properties.isEnabled());
      return ShardedRedisTaskCache.disabled(codec, executor);
    }

    List<RedissonClient> shards = clientFactory.connect(properties);
    ShardedRedisTaskCache cache = new ShardedRedisTaskCache(shards, codec, executor);
    CacheOutcome ping = cache.ping();
    if (ping.isFailed()) {
      cache.close();
      throw new IllegalStateException("Task cache shard unreachable at startup", ping.error());
    }
    log.info(
        "[TaskCache] caching enabled: shards={}, entityTtl={}, listTtl={}",
        cache.shardCount(),
        properties.getEntityTtl(),
        properties.getListTtl());
    return cache;
  }

  @Bean
  @Primary
  public TaskRepository taskRepository(
      TaskRepositoryImpl taskStoreRepository,
      TaskCachePort taskCache,
      TaskCacheProperties properties) {
    return new CachedTaskRepository(
        taskStoreRepository, taskCache, properties.getEntityTtl(), properties.getListTtl());
  }
}
