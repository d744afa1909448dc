package com.example.trackscheduler.infrastructure.library;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.trackscheduler.application.service.PersistenceAdvisoryService;
import com.example.trackscheduler.domain.model.UserPlaylist;
import com.example.trackscheduler.infrastructure.persistence.PlaylistsRepository;
import com.example.trackscheduler.infrastructure.persistence.model.PlaylistsDocument;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ScheduledExecutorService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class PersistentPlaylistStoreTest {

    private final Set<String> missingOnDisk = new HashSet<>();
    private PlaylistsRepository repository;
    private PersistenceAdvisoryService advisoryService;
    private PersistentPlaylistStore store;

    @BeforeEach
    void setUp() {
        repository = mock(PlaylistsRepository.class);
        advisoryService = mock(PersistenceAdvisoryService.class);
        Clock clock = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);
        store = new PersistentPlaylistStore(repository, advisoryService, mock(ScheduledExecutorService.class),
                60_000L, path -> !missingOnDisk.contains(path), clock);
    }

    @Test
    void shouldStoreCanonicalCasePreservingPathsWithoutDuplicates() {
        UserPlaylist created = store.create("Road trip",
                Arrays.asList("/Music/./A.mp3", "/music/a.mp3", "/Music/B.mp3", "  "));

        assertEquals(Arrays.asList("/Music/A.mp3", "/Music/B.mp3"), created.getTrackPaths());
        assertEquals(Instant.parse("2024-05-01T10:00:00Z"), created.getCreatedAt());
    }

    @Test
    void shouldFilterMembersToExistingPaths() {
        UserPlaylist created = store.create("p", Arrays.asList("/a.mp3", "/b.mp3", "/c.mp3"));
        missingOnDisk.add("/b.mp3");

        assertEquals(Arrays.asList("/a.mp3", "/c.mp3"), store.membersInOrder(created.getId()));
        assertNull(store.membersInOrder("unknown"));
    }

    @Test
    void shouldAddOnlyNewMembers() {
        UserPlaylist created = store.create("p", Collections.singletonList("/a.mp3"));

        List<String> added = store.addTracks(created.getId(), Arrays.asList("/A.mp3", "/b.mp3", "/b.mp3"));

        assertEquals(Collections.singletonList("/b.mp3"), added);
        assertEquals(Arrays.asList("/a.mp3", "/b.mp3"), store.find(created.getId()).getTrackPaths());
        assertNull(store.addTracks("unknown", Collections.singletonList("/x.mp3")));
    }

    @Test
    void shouldRemoveMemberByLookupKey() {
        UserPlaylist created = store.create("p", Arrays.asList("/Music/A.mp3", "/Music/B.mp3"));

        assertEquals("/Music/A.mp3", store.removeTrack(created.getId(), "/music/a.mp3"));
        assertNull(store.removeTrack(created.getId(), "/music/a.mp3"));
        assertEquals(Collections.singletonList("/Music/B.mp3"), store.find(created.getId()).getTrackPaths());
    }

    @Test
    void shouldRenameDeleteAndReturnCopies() {
        UserPlaylist created = store.create("old", Collections.<String>emptyList());
        created.getTrackPaths().add("/mutated.mp3");

        UserPlaylist renamed = store.rename(created.getId(), "new");
        assertNotNull(renamed);
        assertEquals("new", renamed.getName());
        assertTrue(store.find(created.getId()).getTrackPaths().isEmpty());

        assertTrue(store.delete(created.getId()));
        assertFalse(store.delete(created.getId()));
        assertNull(store.rename(created.getId(), "again"));
        assertTrue(store.listPlaylists().isEmpty());
    }

    @Test
    void shouldLoadSavedPlaylistsInOrderSkippingBrokenEntries() {
        PlaylistsDocument document = new PlaylistsDocument(PlaylistsDocument.CURRENT_VERSION, Arrays.asList(
                new PlaylistsDocument.Entry("p1", "First", Arrays.asList("/Music/./A.mp3", "/music/a.mp3"),
                        1000L, 2000L),
                new PlaylistsDocument.Entry(null, "No id", Collections.<String>emptyList(), null, null),
                new PlaylistsDocument.Entry("p2", "Second", null, null, null)));
        when(repository.load()).thenReturn(document);

        List<UserPlaylist> playlists = store.listPlaylists();

        assertEquals(2, playlists.size());
        assertEquals("p1", playlists.get(0).getId());
        assertEquals(Collections.singletonList("/Music/A.mp3"), playlists.get(0).getTrackPaths());
        assertEquals(Instant.ofEpochMilli(2000L), playlists.get(0).getUpdatedAt());
        assertTrue(playlists.get(1).getTrackPaths().isEmpty());
    }

    @Test
    void shouldWriteEveryPlaylistOnFlush() throws IOException {
        UserPlaylist created = store.create("Mix", Arrays.asList("/a.mp3", "/b.mp3"));

        store.flush();

        ArgumentCaptor<PlaylistsDocument> saved = ArgumentCaptor.forClass(PlaylistsDocument.class);
        verify(repository).save(saved.capture());
        assertEquals(PlaylistsDocument.CURRENT_VERSION, saved.getValue().getVersion());
        PlaylistsDocument.Entry entry = saved.getValue().getPlaylists().get(0);
        assertEquals(created.getId(), entry.getId());
        assertEquals("Mix", entry.getName());
        assertEquals(Arrays.asList("/a.mp3", "/b.mp3"), entry.getTrackPaths());
        assertEquals(Long.valueOf(Instant.parse("2024-05-01T10:00:00Z").toEpochMilli()), entry.getCreatedAt());
    }

    @Test
    void shouldReportAdvisoryWhenSaveFails() throws IOException {
        doThrow(new IOException("disk full")).when(repository).save(any(PlaylistsDocument.class));
        store.create("Mix", null);

        store.flush();

        verify(advisoryService).report(eq("playlists"),
                any(String.class), any(String.class), any(IOException.class));
        assertEquals(1, store.listPlaylists().size());
    }

    @Test
    void shouldSkipFlushBeforeFirstAccess() throws IOException {
        store.flush();

        verify(repository, never()).load();
        verify(repository, never()).save(any(PlaylistsDocument.class));
    }
}
