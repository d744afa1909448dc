package com.example.trackscheduler.common.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.scheduler")
public class AppSchedulerProperties {

    /**
     * Directory holding the weight, scope, playlist and queue JSON files.
     */
    private String dataDir = System.getProperty("user.home") + "/.track-scheduler";

    /**
     * Rapid weight edits inside this window are coalesced into one write.
     */
    private long weightFlushDebounceMs = 500L;

    /**
     * Debounce for persisting the scope selector and current-track pointer.
     */
    private long scopeFlushDebounceMs = 300L;

    /**
     * Debounce for saving playlists and the track queue.
     */
    private long libraryFlushDebounceMs = 300L;

    /**
     * Playlist members are filtered to paths that exist on disk.
     */
    private boolean verifyMemberPaths = true;

    /**
     * Tracks whose tags are read per background hydration batch.
     */
    private int hydrationBatchSize = 16;

    private int hydrationThreadCount = 2;

    private boolean restoreOnStartup = true;

    /**
     * Max persistence advisories kept in memory.
     */
    private int advisoryCapacity = 20;
}
