package io.marketsync.market.shard;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ShardRouterTest {
    private final ShardRouter router = new ShardRouter(ShardRouter.DEFAULT_SHARDS);

    @Test
    void routes_by_md5_prefix() {
        for (String k : List.of("600000.SH", "830799.BJ", "600519.SH", "000858.SZ", "300059.SZ")) {
            assertEquals("AS_5MIN_P1", router.route(k), k);
        }
        for (String k : List.of("000001.SZ", "300750.SZ", "000002.SZ", "688981.SH", "601318.SH", "600036.SH", "601012.SH")) {
            assertEquals("AS_5MIN_P2", router.route(k), k);
        }
        for (String k : List.of("002594.SZ", "000333.SZ")) {
            assertEquals("AS_5MIN_P3", router.route(k), k);
        }
    }

    @Test
    void routing_is_stable_across_instances() {
        ShardRouter other = new ShardRouter(List.of("AS_5MIN_P1", "AS_5MIN_P2", "AS_5MIN_P3"));
        for (String k : List.of("000001.SZ", "600519.SH", "002594.SZ")) {
            assertEquals(router.index(k), other.index(k));
        }
    }

    @Test
    void partition_keeps_every_shard_and_key_order() {
        Map<String, List<String>> parts = router.partition(List.of("000002.SZ", "600000.SH", "000001.SZ"));
        assertEquals(List.of("AS_5MIN_P1", "AS_5MIN_P2", "AS_5MIN_P3"), List.copyOf(parts.keySet()));
        assertEquals(List.of("600000.SH"), parts.get("AS_5MIN_P1"));
        assertEquals(List.of("000002.SZ", "000001.SZ"), parts.get("AS_5MIN_P2"));
        assertTrue(parts.get("AS_5MIN_P3").isEmpty());
    }

    @Test
    void single_shard_takes_everything() {
        ShardRouter one = new ShardRouter(List.of("ONLY"));
        assertEquals("ONLY", one.route("688981.SH"));
        assertThrows(IllegalArgumentException.class, () -> new ShardRouter(List.of()));
    }
}
