package com.jobtrail.dedup.tracking.service;

import com.jobtrail.dedup.config.TrackingProperties;
import com.jobtrail.dedup.tracking.csv.RawJobCsvReader;
import com.jobtrail.dedup.tracking.model.BatchSummary;
import com.jobtrail.dedup.tracking.model.RawJobRecord;
import com.jobtrail.dedup.tracking.model.RecordRejection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;

/**
 * One-shot import: {@code tracking.cli.run=true} reads {@code tracking.cli.file} and
 * processes it as a single scrape batch.
 */
@Component
public class IngestionCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(IngestionCliRunner.class);

    private final TrackingProperties properties;
    private final RawJobCsvReader csvReader;
    private final IngestionBatchService batchService;
    private final ConfigurableApplicationContext applicationContext;
    private final Clock clock;

    public IngestionCliRunner(
        TrackingProperties properties,
        RawJobCsvReader csvReader,
        IngestionBatchService batchService,
        ConfigurableApplicationContext applicationContext,
        Clock clock
    ) {
        this.properties = properties;
        this.csvReader = csvReader;
        this.batchService = batchService;
        this.applicationContext = applicationContext;
        this.clock = clock;
    }

    @Override
    public void run(ApplicationArguments args) {
        TrackingProperties.Cli cli = properties.getCli();
        if (!cli.isRun()) {
            return;
        }
        if (cli.getFile() == null || cli.getFile().isBlank()) {
            throw new IllegalStateException("tracking.cli.file is required when tracking.cli.run=true");
        }

        List<RawJobRecord> records;
        try {
            records = csvReader.read(Path.of(cli.getFile().trim()));
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read " + cli.getFile(), e);
        }
        String scrapeRunId = cli.getScrapeRunId() == null || cli.getScrapeRunId().isBlank()
            ? "cli-" + clock.instant().toEpochMilli()
            : cli.getScrapeRunId().trim();

        BatchSummary summary = batchService.processBatch(scrapeRunId, cli.getPlatform(), records);
        log.info(
            "Ingestion run {} finished with status {}: total={}, created={}, merged={}, rejected={}",
            summary.scrapeRunId(),
            summary.status(),
            summary.total(),
            summary.created(),
            summary.merged(),
            summary.rejected()
        );
        for (RecordRejection rejection : summary.rejections()) {
            log.info("Rejected row {} ({}): {} {}", rejection.index(), rejection.externalId(), rejection.reason(), rejection.detail());
        }

        if (cli.isExitAfterRun()) {
            int exitCode = SpringApplication.exit(applicationContext, () -> 0);
            System.exit(exitCode);
        }
    }
}
