package com.tsingest.observability;

import com.tsingest.event.BucketLoadedEvent;
import com.tsingest.event.FileIngestedEvent;
import com.tsingest.event.IngestionProgressEvent;
import com.tsingest.ingest.IngestResult;
import com.tsingest.resolution.FileOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Registers and updates the ingestion metrics:
 * <ul>
 *   <li><b>ingest.files.loaded</b> (counter): files loaded, truncated ones included</li>
 *   <li><b>ingest.files.failed</b> (counter): files skipped by the coordinator</li>
 *   <li><b>ingest.rows.read</b> (counter): rows returned by the ingestor</li>
 *   <li><b>ingest.truncations</b> (counter): loads stopped early for lack of memory</li>
 *   <li><b>gaps.detected</b> (counter): gaps found in non-base files</li>
 *   <li><b>repair.failures</b> (counter): gap repairs that failed</li>
 *   <li><b>ingest.file.duration</b> (timer): wall time per file load</li>
 *   <li><b>ingest.rows.in.progress</b> (gauge): rows read so far by the current streamed load</li>
 * </ul>
 *
 * <p>Everything is driven by application events, so metrics never influence a load.
 */
@Service
public class IngestionMetricsService {

    private static final Logger log = LoggerFactory.getLogger(IngestionMetricsService.class);

    private final Counter filesLoadedCounter;
    private final Counter filesFailedCounter;
    private final Counter rowsReadCounter;
    private final Counter truncationsCounter;
    private final Counter gapsDetectedCounter;
    private final Counter repairFailuresCounter;
    private final Timer fileDurationTimer;
    private final AtomicLong rowsInProgress = new AtomicLong();

    public IngestionMetricsService(MeterRegistry meterRegistry) {
        this.filesLoadedCounter = Counter.builder("ingest.files.loaded")
                .description("Files loaded by the ingestor")
                .register(meterRegistry);

        this.filesFailedCounter = Counter.builder("ingest.files.failed")
                .description("Files skipped after an ingestion failure")
                .register(meterRegistry);

        this.rowsReadCounter = Counter.builder("ingest.rows.read")
                .description("Rows returned by the ingestor")
                .register(meterRegistry);

        this.truncationsCounter = Counter.builder("ingest.truncations")
                .description("Loads stopped early because memory headroom ran out")
                .register(meterRegistry);

        this.gapsDetectedCounter = Counter.builder("gaps.detected")
                .description("Gaps detected in non-base files")
                .register(meterRegistry);

        this.repairFailuresCounter = Counter.builder("repair.failures")
                .description("Gap repairs that failed and kept the original data")
                .register(meterRegistry);

        this.fileDurationTimer = Timer.builder("ingest.file.duration")
                .description("Wall time to load one file")
                .publishPercentiles(0.5, 0.95)
                .maximumExpectedValue(Duration.ofMinutes(30))
                .register(meterRegistry);

        meterRegistry.gauge("ingest.rows.in.progress", rowsInProgress);
    }

    @EventListener
    @Order(20)
    public void onFileIngested(FileIngestedEvent event) {
        IngestResult result = event.getResult();
        filesLoadedCounter.increment();
        rowsReadCounter.increment(result.rowsRead());
        fileDurationTimer.record(result.elapsed());
        rowsInProgress.set(0);
        if (result.truncated()) {
            truncationsCounter.increment();
        }
    }

    @EventListener
    @Order(20)
    public void onProgress(IngestionProgressEvent event) {
        rowsInProgress.set(event.getRowsRead());
    }

    @EventListener
    @Order(20)
    public void onBucketLoaded(BucketLoadedEvent event) {
        for (FileOutcome outcome : event.getOutcomes()) {
            switch (outcome.status()) {
                case FAILED -> filesFailedCounter.increment();
                case REPAIR_FAILED -> repairFailuresCounter.increment();
                default -> {
                    // counted on ingestion
                }
            }
            if (outcome.gapCount() > 0) {
                gapsDetectedCounter.increment(outcome.gapCount());
            }
        }
        log.debug("Bucket {} metrics updated from {} outcomes", event.getLabel(), event.getOutcomes().size());
    }
}
