package com.brandmetrics.backend.scheduler;

import com.brandmetrics.backend.service.RefreshOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(name = "refresher.schedule.enabled", havingValue = "true")
public class RefreshScheduler {

    private final RefreshOrchestrator refreshOrchestrator;

    /**
     * Refresh all brands on the configured interval
     */
    @Scheduled(fixedRateString = "${refresher.schedule.interval-ms:900000}", initialDelayString = "${refresher.schedule.interval-ms:900000}")
    public void refreshAll() {
        log.info("⏰ Scheduled refresh starting");
        refreshOrchestrator.runAll();
    }
}
