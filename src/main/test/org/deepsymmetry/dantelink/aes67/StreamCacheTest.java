package org.deepsymmetry.dantelink.aes67;

import org.junit.Test;

import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class StreamCacheTest {

    private static StreamInfo stream(String name, int port) {
        return new StreamInfo(name, 7L, "10.0.0.9", "239.2.2.2", port, "L24/48000/2", 2, null);
    }

    @Test
    public void mergeKeepsSessionsMissingFromLaterWindows() {
        final StreamCache cache = new StreamCache();
        assertEquals(2, cache.merge(Map.of("Alpha", stream("Alpha", 5004), "Beta", stream("Beta", 5006))));
        assertEquals(0, cache.merge(Map.of()));
        assertEquals(2, cache.size());
        assertNotNull(cache.get("Alpha"));
        assertNotNull(cache.get("Beta"));
    }

    @Test
    public void reannouncementOverwrites() {
        final StreamCache cache = new StreamCache();
        cache.put(stream("Alpha", 5004));
        assertEquals(0, cache.merge(Map.of("Alpha", stream("Alpha", 6000))));
        assertEquals(Integer.valueOf(6000), cache.get("Alpha").getPort());
        assertEquals(1, cache.size());
    }

    @Test
    public void streamsAreSortedByName() {
        final StreamCache cache = new StreamCache();
        assertTrue(cache.isEmpty());
        cache.put(stream("Zulu", 1));
        cache.put(stream("Alpha", 2));
        cache.put(stream("Mike", 3));
        assertEquals(List.of("Alpha", "Mike", "Zulu"), List.copyOf(cache.getStreams().keySet()));
    }
}
