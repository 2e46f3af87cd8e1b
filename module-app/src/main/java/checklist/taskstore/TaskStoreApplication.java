package checklist.taskstore;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TaskStoreApplication {

  public static void main(String[] args) {
    SpringApplication.run(TaskStoreApplication.class, args);
  }
}
