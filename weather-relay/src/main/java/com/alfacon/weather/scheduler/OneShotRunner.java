package com.alfacon.weather.scheduler;

import com.alfacon.weather.model.RunSummary;
import com.alfacon.weather.service.WeatherRelayRunService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationContext;
import org.springframework.stereotype.Component;

/**
 * Runs a single cycle and exits, for use under an external scheduler such as a CI cron job.
 * Enabled with weather-relay.scheduling.one-shot=true.
 *
 * Exit codes: 0 PASSED, 1 FAILED, 2 ABORTED.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "weather-relay.scheduling", name = "one-shot", havingValue = "true")
public class OneShotRunner implements ApplicationRunner {

    private final WeatherRelayRunService runService;
    private final ApplicationContext context;

    @Override
    public void run(ApplicationArguments args) {
        RunSummary summary = runService.runOnce();
        int code = exitCode(summary);
        log.info("One-shot run finished with {} (exit code {})", summary.getOutcome(), code);

        ExitCodeGenerator generator = () -> code;
        System.exit(SpringApplication.exit(context, generator));
    }

    static int exitCode(RunSummary summary) {
        return switch (summary.getOutcome()) {
            case PASSED -> 0;
            case FAILED -> 1;
            default -> 2;
        };
    }
}
