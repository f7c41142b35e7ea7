package com.acme.chat.shard;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;

/**
 * Deterministic mapping from a routing key to one of N shard handles.
 *
 * <p>The shard index is the unsigned 32-bit FNV-1a hash of the key's UTF-8 bytes modulo N, so a
 * key resolves to the same shard in every process for as long as N is unchanged. All operations
 * for one channel therefore stay on one store without cross-shard coordination. Routing never
 * fails; reaching the store is the handle's concern.
 *
 * @param <T> shard handle type, e.g. a pooled {@code DataSource}
 */
public final class ShardRouter<T> {

  private static final int FNV_OFFSET_BASIS = 0x811c9dc5;
  private static final int FNV_PRIME = 0x01000193;

  private final List<T> shards;

  public ShardRouter(List<T> shards) {
    Objects.requireNonNull(shards, "shards");
    if (shards.isEmpty()) {
      throw new IllegalArgumentException("at least one shard is required");
    }
    this.shards = List.copyOf(shards);
  }

  public int shardCount() {
    return shards.size();
  }

  /** All handles in shard-index order. */
  public List<T> shards() {
    return shards;
  }

  public T shard(int index) {
    return shards.get(index);
  }

  public int indexFor(String routingKey) {
    Objects.requireNonNull(routingKey, "routingKey");
    if (shards.size() == 1) {
      return 0;
    }
    return Integer.remainderUnsigned(fnv1a32(routingKey), shards.size());
  }

  public T resolve(String routingKey) {
    return shards.get(indexFor(routingKey));
  }

  /** Routing policy of every message operation. */
  public T resolveByChannel(String channelId) {
    return resolve(channelId);
  }

  /**
   * Alternate user-scoped policy. Not used by the message path: a channel's messages must live on
   * the channel's shard.
   */
  public T resolveByUser(String userId) {
    return resolve(userId);
  }

  static int fnv1a32(String key) {
    int hash = FNV_OFFSET_BASIS;
    for (byte b : key.getBytes(StandardCharsets.UTF_8)) {
      hash ^= (b & 0xff);
      hash *= FNV_PRIME;
    }
    return hash;
  }
}
