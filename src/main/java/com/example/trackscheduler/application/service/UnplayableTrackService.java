package com.example.trackscheduler.application.service;

import com.example.trackscheduler.common.util.PathKeys;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Tracks that failed to play, keyed by canonical key, regardless of scope.
 */
@Service
public class UnplayableTrackService {

    private static final Logger log = LoggerFactory.getLogger(UnplayableTrackService.class);

    static final String DEFAULT_REASON = "播放失败";

    private final ConcurrentMap<String, String> reasonByKey = new ConcurrentHashMap<>();

    /**
     * @return true when the set of unplayable tracks changed
     */
    public boolean mark(String path, String reason) {
        String key = PathKeys.canonical(path);
        String previous = reasonByKey.put(key, normalizeReason(reason));
        log.info("UNPLAYABLE_EVENT event=mark key={} reason={}", key, reasonByKey.get(key));
        return previous == null;
    }

    /**
     * Removes every mark stored under a key form of the same track.
     */
    public boolean clear(String path) {
        boolean removed = false;
        for (String key : PathKeys.lookupKeys(path)) {
            if (reasonByKey.remove(key) != null) {
                removed = true;
            }
        }
        Iterator<String> iterator = reasonByKey.keySet().iterator();
        while (iterator.hasNext()) {
            if (PathKeys.sameTrack(iterator.next(), path)) {
                iterator.remove();
                removed = true;
            }
        }
        if (removed) {
            log.info("UNPLAYABLE_EVENT event=clear key={}", PathKeys.canonical(path));
        }
        return removed;
    }

    public boolean clearAll() {
        if (reasonByKey.isEmpty()) {
            return false;
        }
        reasonByKey.clear();
        log.info("UNPLAYABLE_EVENT event=clear_all");
        return true;
    }

    /**
     * Matches in both directions: a mark stored under {@code /a/Song.mp3} is
     * found for {@code /a/song.mp3} and the other way round.
     */
    public String reason(String path) {
        List<String> lookupKeys = PathKeys.lookupKeys(path);
        PathKeys.Match<String> match = PathKeys.find(reasonByKey, lookupKeys);
        if (match != null) {
            return match.getValue();
        }
        if (reasonByKey.isEmpty()) {
            return null;
        }
        for (Map.Entry<String, String> entry : reasonByKey.entrySet()) {
            if (PathKeys.sameTrack(entry.getKey(), path)) {
                return entry.getValue();
            }
        }
        return null;
    }

    public boolean isUnplayable(String path) {
        return reason(path) != null;
    }

    public Map<String, String> snapshot() {
        return new LinkedHashMap<>(reasonByKey);
    }

    private String normalizeReason(String raw) {
        String trimmed = raw == null ? "" : raw.trim();
        int newline = trimmed.indexOf('\n');
        String firstLine = newline >= 0 ? trimmed.substring(0, newline).trim() : trimmed;
        return firstLine.isEmpty() ? DEFAULT_REASON : firstLine;
    }
}
