package org.sjsu.puffplanner.service;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.sjsu.puffplanner.config.WizardProperties;
import org.springframework.context.annotation.DependsOn;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs chat work on a fixed set of single-thread lanes. A user always maps to the same lane, so that
 * user's updates are handled strictly one after another, while other users proceed on other lanes.
 * <p>
 * Lanes drain on shutdown before the JPA {@code entityManagerFactory} is closed.
 */
@Component
@DependsOn("entityManagerFactory")
@Slf4j
public class ChatUpdateDispatcher {

    private final List<ExecutorService> lanes;

    public ChatUpdateDispatcher(WizardProperties wizardProperties) {
        int laneCount = wizardProperties.getDispatch().getLanes();
        this.lanes = new ArrayList<>(laneCount);
        for (int i = 0; i < laneCount; i++) {
            lanes.add(Executors.newSingleThreadExecutor(laneThreadFactory(i)));
        }
        log.info("ChatUpdateDispatcher started with {} lanes", laneCount);
    }

    public void dispatch(Long userId, Runnable work) {
        int lane = laneFor(userId);
        lanes.get(lane).execute(() -> {
            try {
                work.run();
            } catch (RuntimeException e) {
                log.error("Unhandled error on lane {} for userId {}: {}", lane, userId, e.getMessage(), e);
            }
        });
    }

    int laneFor(Long userId) {
        return Math.floorMod(userId.hashCode(), lanes.size());
    }

    @PreDestroy
    public void shutdown() {
        log.info("ChatUpdateDispatcher shutting down.");
        lanes.forEach(ExecutorService::shutdown);
        for (ExecutorService lane : lanes) {
            try {
                if (!lane.awaitTermination(10, TimeUnit.SECONDS)) {
                    log.warn("Lane did not drain in time, forcing shutdown");
                    lane.shutdownNow();
                }
            } catch (InterruptedException e) {
                lane.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }

    private static ThreadFactory laneThreadFactory(int index) {
        AtomicInteger created = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "chat-lane-" + index + "-" + created.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
