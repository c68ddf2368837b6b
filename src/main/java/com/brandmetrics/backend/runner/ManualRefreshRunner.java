package com.brandmetrics.backend.runner;

import com.brandmetrics.backend.model.RefreshReport;
import com.brandmetrics.backend.service.RefreshOrchestrator;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * One-shot mode ({@code refresher.run-once=true}): refresh every brand once,
 * print the report as JSON and exit 0 only if every brand succeeded.
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(name = "refresher.run-once", havingValue = "true")
public class ManualRefreshRunner implements CommandLineRunner, ExitCodeGenerator {

    private final RefreshOrchestrator refreshOrchestrator;
    private final ObjectMapper objectMapper;

    private volatile int exitCode = 0;

    @Override
    public void run(String... args) throws Exception {
        log.info("▶️ Running a single refresh from the command line");
        RefreshReport report = refreshOrchestrator.runAll();

        System.out.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(report));
        exitCode = RefreshReport.STATUS_OK.equals(report.getStatus()) ? 0 : 1;
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
