package checklist.taskstore.infrastructure.executor;

import java.util.Objects;

/**
 * 작업 컨텍스트 (로그/메트릭 공통 식별자)
 *
 * <h3>형식</h3>
 *
 * <pre>
 * "component:operation:dynamicValue"
 *
 * 예시:
 * - TaskContext.of("TaskStore", "GetById", "5f0c...")  → "TaskStore:GetById:5f0c..."
 * - TaskContext.of("TaskStore", "List")                → "TaskStore:List"
 * </pre>
 *
 * <ul>
 *   <li>component, operation: 메트릭 태그 (고정 값)
 *   <li>dynamicValue: 로그에만 기록 (태스크 id, 캐시 키 등)
 * </ul>
 */
public record TaskContext(String component, String operation, String dynamicValue) {

  public TaskContext {
    Objects.requireNonNull(component, "component");
    Objects.requireNonNull(operation, "operation");
    if (dynamicValue == null) {
      dynamicValue = "";
    }
  }

  public static TaskContext of(String component, String operation, Object dynamicValue) {
    return new TaskContext(
        component, operation, dynamicValue == null ? "" : dynamicValue.toString());
  }

  public static TaskContext of(String component, String operation) {
    return new TaskContext(component, operation, "");
  }

  public String toTaskName() {
    if (dynamicValue.isEmpty()) {
      return component + ":" + operation;
    }
    return component + ":" + operation + ":" + dynamicValue;
  }
}
