package com.example.trackscheduler.application.service;

import com.example.trackscheduler.common.config.AppSchedulerProperties;
import com.example.trackscheduler.domain.model.PersistenceAdvisory;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

/**
 * Collects non-fatal persistence failures for the UI. In-memory state stays
 * authoritative whatever is reported here.
 */
@Service
public class PersistenceAdvisoryService {

    private static final Logger log = LoggerFactory.getLogger(PersistenceAdvisoryService.class);

    private final int capacity;
    private final Clock clock;
    private final MeterRegistry meterRegistry;
    private final Deque<PersistenceAdvisory> advisories = new ArrayDeque<>();

    public PersistenceAdvisoryService(AppSchedulerProperties properties,
                                      ObjectProvider<MeterRegistry> meterRegistryProvider) {
        this(properties, meterRegistryProvider, Clock.systemUTC());
    }

    PersistenceAdvisoryService(AppSchedulerProperties properties,
                               ObjectProvider<MeterRegistry> meterRegistryProvider,
                               Clock clock) {
        this.capacity = Math.max(1, properties.getAdvisoryCapacity());
        this.meterRegistry = meterRegistryProvider.getIfAvailable();
        this.clock = clock;
    }

    public void report(String source, String title, String subtitle, Throwable cause) {
        log.warn("PERSISTENCE_EVENT event=save_failed source={} title={} reason={}",
                source, title, cause == null ? null : cause.getMessage());
        PersistenceAdvisory advisory = new PersistenceAdvisory(source, title, subtitle, clock.millis());
        synchronized (advisories) {
            advisories.addFirst(advisory);
            while (advisories.size() > capacity) {
                advisories.removeLast();
            }
        }
        if (meterRegistry != null) {
            try {
                meterRegistry.counter("music.persistence.advisory", "source", source).increment();
            } catch (Exception ex) {
                log.debug("Advisory metric failed, source={}", source, ex);
            }
        }
    }

    /**
     * Newest first.
     */
    public List<PersistenceAdvisory> recent() {
        synchronized (advisories) {
            return new ArrayList<>(advisories);
        }
    }

    public void clear() {
        synchronized (advisories) {
            advisories.clear();
        }
    }
}
