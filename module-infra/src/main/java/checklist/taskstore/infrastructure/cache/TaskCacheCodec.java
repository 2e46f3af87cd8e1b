package checklist.taskstore.infrastructure.cache;

import checklist.taskstore.domain.model.task.Task;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.util.List;

/**
 * Task ↔ JSON 직렬화
 *
 * <p>타임스탬프는 ISO-8601 문자열로 저장합니다. 역직렬화 실패(손상된 엔트리 등)는 호출 측에서 캐시 실패로 처리됩니다.
 */
public class TaskCacheCodec {

  private static final TypeReference<List<TaskSnapshot>> SNAPSHOT_LIST = new TypeReference<>() {};

  private final ObjectMapper objectMapper;

  public TaskCacheCodec() {
    this(defaultObjectMapper());
  }

  public TaskCacheCodec(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public static ObjectMapper defaultObjectMapper() {
    return JsonMapper.builder()
        .addModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .build();
  }

  public String encodeTask(Task task) throws JsonProcessingException {
    return objectMapper.writeValueAsString(TaskSnapshot.from(task));
  }

  public Task decodeTask(String json) throws JsonProcessingException {
    return objectMapper.readValue(json, TaskSnapshot.class).toDomain();
  }

  public String encodeList(List<Task> tasks) throws JsonProcessingException {
    return objectMapper.writeValueAsString(tasks.stream().map(TaskSnapshot::from).toList());
  }

  public List<Task> decodeList(String json) throws JsonProcessingException {
    List<TaskSnapshot> snapshots = objectMapper.readValue(json, SNAPSHOT_LIST);
    return snapshots.stream().map(TaskSnapshot::toDomain).toList();
  }
}
