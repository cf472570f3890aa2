package com.owldoor.geocoder.config;

import com.owldoor.geocoder.model.BatchState;
import com.owldoor.geocoder.model.GeocodeRun;
import com.owldoor.geocoder.service.BatchProcessor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

/**
 * Runs the job described by {@code bulk-geocoder.job.*} at startup, e.g.
 *
 * <pre>
 * java -jar bulk-geocoder.jar --spring.main.web-application-type=none \
 *     --bulk-geocoder.job.input=agents.csv --bulk-geocoder.job.output=out.csv \
 *     --bulk-geocoder.job.address-column=full_address --bulk-geocoder.job.resume=true
 * </pre>
 *
 * Exit code is 0 when the run completes and 1 when it aborts.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class GeocodeJobRunner implements ApplicationRunner, ExitCodeGenerator {

    private final BatchProcessor batchProcessor;
    private final BulkGeocoderProperties properties;

    private volatile Integer exitCode;

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getJob().isConfigured()) {
            log.info("Geocoder ready. No startup job configured; submit jobs via POST /geocode/jobs");
            return;
        }
        log.info("Running startup job: {}", properties.getJob());
        GeocodeRun run = batchProcessor.run(properties.getJob().toJob());
        exitCode = run.getState() == BatchState.COMPLETED ? 0 : 1;
    }

    public boolean hasRun() {
        return exitCode != null;
    }

    @Override
    public int getExitCode() {
        return exitCode == null ? 0 : exitCode;
    }
}
