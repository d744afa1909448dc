package com.example.trackscheduler.common.util;

import java.text.Normalizer;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Derives track identity keys from filesystem paths.
 *
 * <p>The canonical key is the standardized path (no {@code .} or {@code ..}
 * segments, no duplicate or trailing separators) in Unicode NFC. It keeps the
 * original case and is the only form ever written. Lookup keys add the legacy
 * formats older records may have been stored under, in priority order.
 */
public final class PathKeys {

    private static final char SEPARATOR = '/';

    /**
     * Historical key formats, most recent first. Each one is applied to the
     * canonical key.
     */
    private static final List<UnaryOperator<String>> LEGACY_FORMATS = Collections.singletonList(
            key -> key.toLowerCase(Locale.ROOT)
    );

    private PathKeys() {
    }

    public static String canonical(String path) {
        if (path == null || path.isEmpty()) {
            return "";
        }
        String standardized = standardize(path.replace('\\', SEPARATOR));
        return Normalizer.normalize(standardized, Normalizer.Form.NFC);
    }

    public static List<String> lookupKeys(String path) {
        String canonical = canonical(path);
        Set<String> keys = new LinkedHashSet<>();
        keys.add(canonical);
        for (UnaryOperator<String> format : LEGACY_FORMATS) {
            keys.add(format.apply(canonical));
        }
        return new ArrayList<>(keys);
    }

    /**
     * True when both paths share at least one lookup key.
     */
    public static boolean sameTrack(String left, String right) {
        List<String> rightKeys = lookupKeys(right);
        for (String key : lookupKeys(left)) {
            if (rightKeys.contains(key)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Two-phase lookup: the first lookup key (the canonical one) wins, then each
     * legacy variant in order. Has no side effects; callers decide whether to
     * rewrite a legacy hit under {@link Match#getCanonicalKey()}.
     */
    public static <V> Match<V> find(Map<String, V> map, List<String> lookupKeys) {
        if (map == null || map.isEmpty() || lookupKeys == null || lookupKeys.isEmpty()) {
            return null;
        }
        String canonical = lookupKeys.get(0);
        for (String key : lookupKeys) {
            V value = map.get(key);
            if (value != null) {
                return new Match<>(canonical, key, value);
            }
        }
        return null;
    }

    private static String standardize(String path) {
        boolean absolute = path.charAt(0) == SEPARATOR;
        Deque<String> segments = new ArrayDeque<>();
        int start = 0;
        int length = path.length();
        while (start <= length) {
            int end = path.indexOf(SEPARATOR, start);
            if (end < 0) {
                end = length;
            }
            String segment = path.substring(start, end);
            start = end + 1;
            if (segment.isEmpty() || ".".equals(segment)) {
                continue;
            }
            if ("..".equals(segment)) {
                if (!segments.isEmpty() && !"..".equals(segments.peekLast())) {
                    segments.removeLast();
                } else if (!absolute) {
                    segments.addLast(segment);
                }
                continue;
            }
            segments.addLast(segment);
        }

        StringBuilder sb = new StringBuilder(length);
        if (absolute) {
            sb.append(SEPARATOR);
        }
        Iterator<String> iterator = segments.iterator();
        while (iterator.hasNext()) {
            sb.append(iterator.next());
            if (iterator.hasNext()) {
                sb.append(SEPARATOR);
            }
        }
        if (sb.length() == 0) {
            return ".";
        }
        return sb.toString();
    }

    public static final class Match<V> {

        private final String canonicalKey;
        private final String matchedKey;
        private final V value;

        Match(String canonicalKey, String matchedKey, V value) {
            this.canonicalKey = canonicalKey;
            this.matchedKey = matchedKey;
            this.value = value;
        }

        public String getCanonicalKey() {
            return canonicalKey;
        }

        public String getMatchedKey() {
            return matchedKey;
        }

        public V getValue() {
            return value;
        }

        public boolean isLegacyHit() {
            return !canonicalKey.equals(matchedKey);
        }
    }
}
