package com.asiainfo.errortracking.infrastructure.cache;

import com.asiainfo.errortracking.application.engine.BreakdownsResponse;
import com.asiainfo.errortracking.domain.model.BreakdownSpec;
import com.asiainfo.errortracking.domain.model.GroupedBreakdownResult;
import com.asiainfo.errortracking.domain.model.Team;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BreakdownsCacheTest {

    private static final BreakdownsResponse RESPONSE =
            new BreakdownsResponse(GroupedBreakdownResult.empty(), "SELECT 1", Map.of(), false);

    private static BreakdownsCacheKey key(long team, String issue) {
        return BreakdownsCacheKey.of(new Team(team),
                new BreakdownSpec(List.of("$browser"), null, null, false, issue, null), 3);
    }

    @Test
    void testPutAndGet() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        BreakdownsCache cache = CacheTestSupport.newCache(true, registry);

        assertNull(cache.get(key(1, "issue-1")));
        cache.put(key(1, "issue-1"), RESPONSE);

        assertEquals(RESPONSE, cache.get(key(1, "issue-1")));
        assertEquals(1.0, registry.counter("breakdowns.cache.hits").count());
    }

    @Test
    void testEntriesAreIsolatedByTeamAndIssue() {
        BreakdownsCache cache = CacheTestSupport.newCache(true);
        cache.put(key(1, "issue-1"), RESPONSE);

        assertNull(cache.get(key(2, "issue-1")));
        assertNull(cache.get(key(1, "issue-2")));
    }

    @Test
    void testDisabledCache() {
        BreakdownsCache cache = CacheTestSupport.newCache(false);

        cache.put(key(1, "issue-1"), RESPONSE);

        assertNull(cache.get(key(1, "issue-1")));
    }
}
