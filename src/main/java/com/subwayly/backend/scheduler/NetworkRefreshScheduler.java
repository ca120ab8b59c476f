package com.subwayly.backend.scheduler;

import com.subwayly.backend.exception.SubwayException;
import com.subwayly.backend.service.SubwayNetworkService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@Slf4j
public class NetworkRefreshScheduler {

    private final SubwayNetworkService networkService;

    @Value("${subwayly.network.preload:false}")
    private boolean preload;

    @EventListener(ApplicationReadyEvent.class)
    public void preloadOnStart() {
        if (!preload) {
            return;
        }
        if (networkService.hasNetwork()) {
            log.info("⏭️ Subway network already loaded, skipping startup preload");
            return;
        }
        log.info("⏰ Preloading subway network on startup...");
        performRefresh();
    }

    @Scheduled(cron = "${subwayly.network.refresh.cron:0 0 4 * * *}")
    public void scheduleRefresh() {
        log.info("⏰ Triggering scheduled subway network refresh...");
        performRefresh();
    }

    private void performRefresh() {
        long startTime = System.currentTimeMillis();
        try {
            networkService.refresh();
            log.info("✅ Network refresh finished in {} ms", System.currentTimeMillis() - startTime);
        } catch (SubwayException e) {
            // the previous snapshot keeps serving queries
            log.error("💥 Network refresh failed after {} ms", System.currentTimeMillis() - startTime, e);
        }
    }
}
