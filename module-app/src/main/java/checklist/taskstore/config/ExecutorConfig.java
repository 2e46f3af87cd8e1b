package checklist.taskstore.config;

import checklist.taskstore.infrastructure.cache.ShardedRedisTaskCache;
import checklist.taskstore.infrastructure.config.TaskStoreProperties;
import checklist.taskstore.infrastructure.executor.DefaultLogicExecutor;
import checklist.taskstore.infrastructure.executor.LogicExecutor;
import checklist.taskstore.infrastructure.executor.policy.ExecutionPipeline;
import checklist.taskstore.infrastructure.executor.policy.ExecutionPolicy;
import checklist.taskstore.infrastructure.executor.policy.LoggingPolicy;
import checklist.taskstore.infrastructure.executor.policy.MetricsPolicy;
import checklist.taskstore.infrastructure.executor.strategy.ExceptionTranslator;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.AnnotationAwareOrderComparator;

/**
 * LogicExecutor 설정
 *
 * <ul>
 *   <li><b>정책</b>: {@link LoggingPolicy}(느린 호출 임계치), {@link MetricsPolicy}(Micrometer Timer)
 *   <li><b>캐시 실패</b>: 결과 타입으로 반환되므로 LoggingPolicy 는 WARN 한 줄만 남김
 *   <li><b>파이프라인</b>: 등록된 정책을 {@code @Order} 순으로 정렬
 *   <li><b>기본 번역기</b>: 분류 체계 예외는 통과, 나머지는 InternalSystemException. 저장소 어댑터는 전용 번역기를
 *       호출 시점에 넘깁니다.
 * </ul>
 */
@Configuration
@EnableConfigurationProperties(TaskStoreProperties.class)
public class ExecutorConfig {

  @Bean
  public LoggingPolicy loggingPolicy(TaskStoreProperties properties) {
    return new LoggingPolicy(
        properties.getSlowQueryThreshold().toMillis(), Set.of(ShardedRedisTaskCache.COMPONENT));
  }

  @Bean
  public MetricsPolicy metricsPolicy(MeterRegistry meterRegistry) {
    return new MetricsPolicy(meterRegistry);
  }

  @Bean
  @ConditionalOnMissingBean(ExecutionPipeline.class)
  public ExecutionPipeline executionPipeline(List<ExecutionPolicy> policies) {
    List<ExecutionPolicy> ordered = new ArrayList<>(policies);
    AnnotationAwareOrderComparator.sort(ordered);
    return new ExecutionPipeline(ordered);
  }

  @Bean
  @ConditionalOnMissingBean(LogicExecutor.class)
  public LogicExecutor logicExecutor(ExecutionPipeline pipeline) {
    return new DefaultLogicExecutor(pipeline, ExceptionTranslator.defaultTranslator());
  }
}
