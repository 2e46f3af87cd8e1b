package checklist.taskstore.infrastructure.cache;

import java.nio.charset.StandardCharsets;
import java.util.zip.CRC32;

/**
 * 캐시 키 → 샤드 인덱스 라우팅
 *
 * <p>CRC-32(IEEE) 체크섬을 샤드 수로 나눈 나머지를 사용합니다. 같은 키와 같은 샤드 수라면 항상 같은 샤드로 라우팅됩니다. 샤드 수를 바꾸면 캐시
 * 전체를 비워야 합니다 (리밸런싱 없음).
 */
public final class ShardRouter {

  private final int shardCount;

  public ShardRouter(int shardCount) {
    if (shardCount < 1) {
      throw new IllegalArgumentException("shardCount must be positive: " + shardCount);
    }
    this.shardCount = shardCount;
  }

  public int shardFor(String key) {
    return indexFor(key, shardCount);
  }

  public int shardCount() {
    return shardCount;
  }

  public static int indexFor(String key, int shardCount) {
    if (shardCount == 1) {
      return 0;
    }
    CRC32 crc = new CRC32();
    crc.update(key.getBytes(StandardCharsets.UTF_8));
    return (int) (crc.getValue() % shardCount);
  }
}
