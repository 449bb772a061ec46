package com.vidnyan.vetree.application.service;

import com.vidnyan.vetree.IndexProperties;
import com.vidnyan.vetree.application.port.in.IndexDesignUseCase;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;

/**
 * Collapses bursts of rebuild requests into one full rescan.
 * Each request pushes the pending rescan back by the debounce window.
 */
@Slf4j
@Component
public class RefreshScheduler {

    private final IndexDesignUseCase indexDesignUseCase;
    private final TaskScheduler taskScheduler;
    private final IndexProperties properties;

    private ScheduledFuture<?> pending;

    public RefreshScheduler(IndexDesignUseCase indexDesignUseCase,
                            TaskScheduler refreshTaskScheduler,
                            IndexProperties properties) {
        this.indexDesignUseCase = indexDesignUseCase;
        this.taskScheduler = refreshTaskScheduler;
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void scanOnStartup() {
        if (properties.isScanOnStartup()) {
            log.info("Initial scan of {}", properties.getRootPath());
            requestRefresh();
        }
    }

    /**
     * Schedule a rescan after the debounce window, replacing any rescan not yet started.
     */
    public synchronized void requestRefresh() {
        if (pending != null && !pending.isDone()) {
            pending.cancel(false);
            log.debug("Coalesced pending refresh");
        }
        Instant at = Instant.now().plus(Duration.ofMillis(properties.getRefreshDebounceMs()));
        pending = taskScheduler.schedule(this::runRefresh, at);
    }

    public synchronized boolean isRefreshPending() {
        return pending != null && !pending.isDone();
    }

    private void runRefresh() {
        try {
            indexDesignUseCase.refresh();
        } catch (RuntimeException e) {
            log.error("Failed to refresh design index", e);
        }
    }
}
