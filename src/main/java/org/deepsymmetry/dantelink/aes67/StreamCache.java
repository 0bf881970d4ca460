package org.deepsymmetry.dantelink.aes67;

import org.apiguardian.api.API;

import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * <p>Accumulates the AES67 streams we have heard announced, keyed by session name.</p>
 *
 * <p>SAP announcements are sent only every few seconds to minutes, so a single listening window rarely hears
 * every stream. Entries are therefore only ever added or replaced by a later announcement of the same session;
 * a stream that goes unheard in one window is not removed.</p>
 */
@API(status = API.Status.STABLE)
public class StreamCache {

    /**
     * The streams we know about, by session name.
     */
    private final Map<String, StreamInfo> streams = new ConcurrentHashMap<>();

    /**
     * Record a stream, replacing any earlier announcement of the same session.
     *
     * @param stream the stream that was announced
     */
    @API(status = API.Status.STABLE)
    public void put(StreamInfo stream) {
        streams.put(stream.getSessionName(), stream);
    }

    /**
     * Record all the streams heard during a listening window.
     *
     * @param discovered the streams, keyed by session name
     *
     * @return the number of sessions which were not previously known
     */
    @API(status = API.Status.STABLE)
    public int merge(Map<String, StreamInfo> discovered) {
        int added = 0;
        for (StreamInfo stream : discovered.values()) {
            if (streams.put(stream.getSessionName(), stream) == null) {
                added++;
            }
        }
        return added;
    }

    /**
     * Look up a stream by session name.
     *
     * @param sessionName the name of the session
     *
     * @return the most recent announcement of that session, or {@code null} if it has never been heard
     */
    @API(status = API.Status.STABLE)
    public StreamInfo get(String sessionName) {
        return streams.get(sessionName);
    }

    /**
     * Get all the streams we know about.
     *
     * @return an immutable snapshot of the streams, sorted by session name
     */
    @API(status = API.Status.STABLE)
    public SortedMap<String, StreamInfo> getStreams() {
        return Collections.unmodifiableSortedMap(new TreeMap<>(streams));
    }

    /**
     * Check how many streams we know about.
     *
     * @return the number of distinct sessions heard since we were created
     */
    @API(status = API.Status.STABLE)
    public int size() {
        return streams.size();
    }

    /**
     * Check whether we have heard of any streams at all.
     *
     * @return {@code true} if no streams have been recorded
     */
    @API(status = API.Status.STABLE)
    public boolean isEmpty() {
        return streams.isEmpty();
    }

    @Override
    public String toString() {
        return "StreamCache[sessions:" + new TreeMap<>(streams).keySet() + "]";
    }
}
