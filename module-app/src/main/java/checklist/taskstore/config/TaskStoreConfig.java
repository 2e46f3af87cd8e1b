package checklist.taskstore.config;

import checklist.taskstore.domain.model.task.TaskId;
import checklist.taskstore.infrastructure.config.TaskStoreProperties;
import checklist.taskstore.infrastructure.executor.LogicExecutor;
import checklist.taskstore.infrastructure.persistence.TaskRepositoryImpl;
import checklist.taskstore.infrastructure.persistence.TaskStoreConnectionVerifier;
import checklist.taskstore.infrastructure.persistence.TaskStoreExceptionTranslator;
import checklist.taskstore.infrastructure.persistence.TaskStoreHealthChecker;
import java.time.Clock;
import javax.sql.DataSource;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.sql.init.SqlDataSourceScriptDatabaseInitializer;
import org.springframework.boot.autoconfigure.sql.init.SqlInitializationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * 원천 저장소(JDBC) 어댑터와 기동 시 연결 확인
 *
 * <h3>기동 순서</h3>
 *
 * <ol>
 *   <li>스키마 초기화 빈 생성 시 {@link TaskStoreConnectionVerifier}로 연결 확인 (고정 간격 재시도)
 *   <li>{@code schema.sql} 실행
 *   <li>JdbcTemplate 및 저장소 어댑터 생성 (초기화 빈 이후로 자동 정렬됨)
 * </ol>
 *
 * <p>초기화 빈을 직접 등록하므로 Boot 기본 {@code SqlDataSourceScriptDatabaseInitializer}는 등록되지 않습니다.
 */
@Configuration
@EnableConfigurationProperties(SqlInitializationProperties.class)
public class TaskStoreConfig {

  @Bean
  @ConditionalOnMissingBean(Clock.class)
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public TaskStoreExceptionTranslator taskStoreExceptionTranslator() {
    return new TaskStoreExceptionTranslator();
  }

  /**
   * 연결 확인 후 스키마 초기화
   *
   * <p>JdbcTemplate 빈은 이 빈에 의존하므로 확인용 템플릿은 여기서 따로 만듭니다. 모든 시도가 실패하면 예외가 전파되어 기동이 중단됩니다.
   */
  @Bean
  public SqlDataSourceScriptDatabaseInitializer taskStoreSchemaInitializer(
      DataSource dataSource,
      SqlInitializationProperties sqlInitProperties,
      LogicExecutor executor,
      TaskStoreExceptionTranslator translator,
      TaskStoreProperties properties) {
    TaskStoreHealthChecker startupChecker =
        new TaskStoreHealthChecker(new JdbcTemplate(dataSource), executor, translator);
    TaskStoreProperties.StartupRetry retry = properties.getStartupRetry();
    new TaskStoreConnectionVerifier(startupChecker, retry.getMaxAttempts(), retry.getBackoff())
        .verify();
    return new SqlDataSourceScriptDatabaseInitializer(dataSource, sqlInitProperties);
  }

  /** 캐시 데코레이터가 감싸는 원천 저장소. 직접 주입받지 말고 {@code TaskRepository}를 사용 */
  @Bean
  public TaskRepositoryImpl taskStoreRepository(
      JdbcTemplate jdbcTemplate,
      LogicExecutor executor,
      TaskStoreExceptionTranslator translator,
      Clock clock) {
    return new TaskRepositoryImpl(jdbcTemplate, executor, translator, clock, TaskId::generate);
  }

  @Bean
  public TaskStoreHealthChecker taskStoreHealthChecker(
      JdbcTemplate jdbcTemplate, LogicExecutor executor, TaskStoreExceptionTranslator translator) {
    return new TaskStoreHealthChecker(jdbcTemplate, executor, translator);
  }
}
