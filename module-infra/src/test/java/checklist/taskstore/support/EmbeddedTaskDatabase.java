package checklist.taskstore.support;

import java.util.UUID;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;

/** 테스트마다 격리된 H2 인메모리 tasks 스키마 */
public final class EmbeddedTaskDatabase {

  private EmbeddedTaskDatabase() {}

  public static EmbeddedDatabase create() {
    return new EmbeddedDatabaseBuilder()
        .setType(EmbeddedDatabaseType.H2)
        .setName("tasks-" + UUID.randomUUID())
        .addScript("classpath:db/task-schema.sql")
        .build();
  }
}
