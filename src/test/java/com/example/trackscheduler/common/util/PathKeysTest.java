package com.example.trackscheduler.common.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class PathKeysTest {

    @Test
    void shouldStandardizeDotSegmentsAndSeparators() {
        assertEquals("/Music/Song.mp3", PathKeys.canonical("/Music/./Album/../Song.mp3"));
        assertEquals("/Music/Song.mp3", PathKeys.canonical("//Music///Song.mp3/"));
        assertEquals("C:/Music/Song.mp3", PathKeys.canonical("C:\\Music\\Song.mp3"));
        assertEquals("../shared/a.flac", PathKeys.canonical("../shared/./a.flac"));
        assertEquals("/", PathKeys.canonical("/.."));
    }

    @Test
    void shouldNeverFailOnDegenerateInput() {
        assertEquals("", PathKeys.canonical(null));
        assertEquals("", PathKeys.canonical(""));
        assertEquals(".", PathKeys.canonical("./"));
        assertEquals(".", PathKeys.canonical("a/.."));
    }

    @Test
    void shouldComposeUnicodeToNfc() {
        String decomposed = "/Music/Cafe\u0301.mp3";
        String composed = "/Music/Caf\u00e9.mp3";
        assertEquals(composed, PathKeys.canonical(decomposed));
        assertEquals(PathKeys.canonical(composed), PathKeys.canonical(decomposed));
    }

    @Test
    void shouldKeepCanonicalCaseButCollideOnLegacyKey() {
        assertEquals("/Music/Song.mp3", PathKeys.canonical("/Music/Song.mp3"));
        assertFalse(PathKeys.canonical("/Music/Song.mp3").equals(PathKeys.canonical("/Music/song.mp3")));

        List<String> keys = PathKeys.lookupKeys("/Music/Song.mp3");
        assertEquals(Arrays.asList("/Music/Song.mp3", "/music/song.mp3"), keys);
        assertTrue(PathKeys.sameTrack("/Music/Song.mp3", "/Music/song.mp3"));
        assertFalse(PathKeys.sameTrack("/Music/Song.mp3", "/Music/Other.mp3"));
    }

    @Test
    void shouldNotDuplicateLookupKeysForLowercasePath() {
        assertEquals(Collections.singletonList("/music/a.mp3"), PathKeys.lookupKeys("/music/a.mp3"));
    }

    @Test
    void shouldPreferCanonicalHitOverLegacyHit() {
        Map<String, Integer> map = new HashMap<>();
        map.put("/music/song.mp3", 1);
        map.put("/Music/Song.mp3", 3);

        PathKeys.Match<Integer> match = PathKeys.find(map, PathKeys.lookupKeys("/Music/Song.mp3"));

        assertNotNull(match);
        assertEquals(3, match.getValue().intValue());
        assertFalse(match.isLegacyHit());
    }

    @Test
    void shouldReportLegacyHitWithoutTouchingMap() {
        Map<String, Integer> map = new HashMap<>();
        map.put("/music/song.mp3", 2);

        PathKeys.Match<Integer> match = PathKeys.find(map, PathKeys.lookupKeys("/Music/Song.mp3"));

        assertNotNull(match);
        assertTrue(match.isLegacyHit());
        assertEquals("/music/song.mp3", match.getMatchedKey());
        assertEquals("/Music/Song.mp3", match.getCanonicalKey());
        assertEquals(1, map.size());
        assertTrue(map.containsKey("/music/song.mp3"));
    }

    @Test
    void shouldReturnNullWhenNothingMatches() {
        assertNull(PathKeys.find(new HashMap<String, Integer>(), PathKeys.lookupKeys("/a.mp3")));
        assertNull(PathKeys.find(Collections.singletonMap("/b.mp3", 1), PathKeys.lookupKeys("/a.mp3")));
    }
}
