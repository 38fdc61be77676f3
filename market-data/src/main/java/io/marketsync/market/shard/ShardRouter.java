package io.marketsync.market.shard;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Stable key to shard mapping: the first 8 hex digits of the key's MD5, modulo the shard count.
 * Changing the shard list reassigns keys, so the list is fixed per deployment.
 */
public final class ShardRouter {
    public static final List<String> DEFAULT_SHARDS = List.of("AS_5MIN_P1", "AS_5MIN_P2", "AS_5MIN_P3");

    private final List<String> shards;

    public ShardRouter(List<String> shards) {
        if (shards == null || shards.isEmpty()) throw new IllegalArgumentException("at least one shard required");
        this.shards = List.copyOf(shards);
    }

    public List<String> shards() { return shards; }

    public int index(String key) {
        byte[] digest = md5(key.getBytes(StandardCharsets.UTF_8));
        long prefix = ((digest[0] & 0xFFL) << 24) | ((digest[1] & 0xFFL) << 16) | ((digest[2] & 0xFFL) << 8) | (digest[3] & 0xFFL);
        return (int) (prefix % shards.size());
    }

    public String route(String key) {
        return shards.get(index(key));
    }

    /** Keys grouped by shard, every shard present (possibly empty), key order preserved. */
    public Map<String, List<String>> partition(List<String> keys) {
        Map<String, List<String>> out = new LinkedHashMap<>();
        for (String s : shards) out.put(s, new ArrayList<>());
        for (String k : keys) out.get(route(k)).add(k);
        return out;
    }

    private static byte[] md5(byte[] data) {
        try {
            return MessageDigest.getInstance("MD5").digest(data);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }
}
