package com.example.trackscheduler.application.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.example.trackscheduler.common.config.AppSchedulerProperties;
import com.example.trackscheduler.domain.model.MemberDelta;
import com.example.trackscheduler.domain.model.PlaybackScope;
import com.example.trackscheduler.domain.model.ScopeRestoration;
import com.example.trackscheduler.infrastructure.library.PlaylistStore;
import com.example.trackscheduler.infrastructure.persistence.JsonFileStore;
import com.example.trackscheduler.infrastructure.persistence.ScopeSelectionRepository;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.support.StaticListableBeanFactory;

class PlaybackScopeServiceTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private ScheduledExecutorService executor;
    private PlaylistStore playlistStore;
    private PlaybackScopeService service;

    @BeforeEach
    void setUp() {
        executor = Executors.newSingleThreadScheduledExecutor();
        AppSchedulerProperties properties = new AppSchedulerProperties();
        properties.setDataDir(tempDir.toString());
        properties.setScopeFlushDebounceMs(60_000L);
        playlistStore = mock(PlaylistStore.class);
        service = newService(properties);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void shouldIndexMembersByPositionAndLookupKey() {
        service.setScopePlaylist("p1", Arrays.asList("/Music/A.mp3", "/Music/./B.mp3", "/music/a.mp3"));

        assertEquals(PlaybackScope.playlist("p1"), service.currentScope());
        assertEquals(Arrays.asList("/Music/A.mp3", "/Music/B.mp3"), service.trackKeys());
        assertEquals(Integer.valueOf(1), service.currentPosition("/Music/B.mp3"));
        assertEquals(Integer.valueOf(0), service.currentPosition("/Music/A.mp3"));
        assertNull(service.currentPosition("/Music/C.mp3"));
        assertTrue(service.isMember("/Music/B.mp3"));
    }

    @Test
    void shouldReportMemberDeltaOnlyForActivePlaylist() {
        service.setScopePlaylist("p1", Arrays.asList("/a.mp3", "/b.mp3"));

        assertNull(service.updateScopeMembersIfActive("p2", Collections.singletonList("/x.mp3")));

        MemberDelta delta = service.updateScopeMembersIfActive("p1", Arrays.asList("/b.mp3", "/c.mp3"));
        assertEquals(Collections.singletonList("/c.mp3"), delta.getAddedKeys());
        assertEquals(Collections.singletonList("/a.mp3"), delta.getRemovedKeys());
        assertEquals(Integer.valueOf(0), service.currentPosition("/b.mp3"));
    }

    @Test
    void shouldForgetMembersWhenSwitchingToQueue() {
        assertFalse(service.setScopeQueue());
        service.setScopePlaylist("p1", Collections.singletonList("/a.mp3"));

        assertTrue(service.setScopeQueue());
        assertTrue(service.currentScope().isQueue());
        assertTrue(service.trackKeys().isEmpty());
        assertNull(service.currentPosition("/a.mp3"));
    }

    @Test
    void shouldPersistScopeSelectorWithCurrentPointer() throws IOException {
        service.setScopePlaylist("p1", Collections.singletonList("/Music/A.mp3"));
        service.rememberCurrent("/Music/A.mp3", 4);
        service.flush();

        JsonNode saved = objectMapper.readTree(tempDir.resolve("playback-scope.json").toFile());
        assertEquals("playlist", saved.get("kind").asText());
        assertEquals("p1", saved.get("playlistID").asText());
        assertEquals("/Music/A.mp3", saved.get("currentKey").asText());
        assertEquals(4, saved.get("currentIndex").asInt());
    }

    @Test
    void shouldRestorePlaylistScopeWithMembers() throws IOException {
        writeScopeFile("{\"kind\":\"playlist\",\"playlistID\":\"p1\",\"currentKey\":\"/b.mp3\"}");
        when(playlistStore.membersInOrder("p1")).thenReturn(Arrays.asList("/a.mp3", "/b.mp3"));

        ScopeRestoration restoration = service.restore();

        assertEquals(PlaybackScope.playlist("p1"), restoration.getScope());
        assertEquals(Arrays.asList("/a.mp3", "/b.mp3"), restoration.getMemberPaths());
        assertEquals("/b.mp3", restoration.getCurrentKey());
        assertEquals(Integer.valueOf(1), service.currentPosition("/b.mp3"));
    }

    @Test
    void shouldFallBackToQueueWhenPlaylistIsGoneOrEmpty() throws IOException {
        writeScopeFile("{\"kind\":\"playlist\",\"playlistID\":\"gone\"}");
        when(playlistStore.membersInOrder("gone")).thenReturn(null);
        assertTrue(service.restore().getScope().isQueue());

        writeScopeFile("{\"kind\":\"playlist\",\"playlistID\":\"empty\"}");
        when(playlistStore.membersInOrder("empty")).thenReturn(Collections.<String>emptyList());
        assertTrue(service.restore().getScope().isQueue());
        assertTrue(service.currentScope().isQueue());
    }

    @Test
    void shouldTreatCorruptOrMissingFileAsQueue() throws IOException {
        assertTrue(service.restore().getScope().isQueue());

        writeScopeFile("{\"kind\":");
        ScopeRestoration restoration = service.restore();
        assertTrue(restoration.getScope().isQueue());
        assertNull(restoration.getCurrentKey());
    }

    private PlaybackScopeService newService(AppSchedulerProperties properties) {
        ScopeSelectionRepository repository =
                new ScopeSelectionRepository(new JsonFileStore(objectMapper), properties);
        PersistenceAdvisoryService advisoryService =
                new PersistenceAdvisoryService(properties, beanProvider(new SimpleMeterRegistry()));
        return new PlaybackScopeService(repository, playlistStore, advisoryService, executor, properties);
    }

    private void writeScopeFile(String json) throws IOException {
        Files.write(tempDir.resolve("playback-scope.json"), json.getBytes(StandardCharsets.UTF_8));
    }

    private ObjectProvider<MeterRegistry> beanProvider(MeterRegistry meterRegistry) {
        StaticListableBeanFactory beanFactory = new StaticListableBeanFactory();
        beanFactory.addBean("meterRegistry", meterRegistry);
        return beanFactory.getBeanProvider(MeterRegistry.class);
    }
}
