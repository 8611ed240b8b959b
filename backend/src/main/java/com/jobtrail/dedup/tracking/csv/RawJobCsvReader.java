package com.jobtrail.dedup.tracking.csv;

import com.jobtrail.dedup.tracking.model.Compensation;
import com.jobtrail.dedup.tracking.model.RawJobRecord;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads scraped postings exported as CSV (one posting per row, header required). Values that
 * do not parse are left null so the row still reaches the pipeline and is judged there.
 */
@Component
public class RawJobCsvReader {
    private static final Logger log = LoggerFactory.getLogger(RawJobCsvReader.class);

    public List<RawJobRecord> read(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader);
        }
    }

    public List<RawJobRecord> read(Reader reader) throws IOException {
        List<RawJobRecord> records = new ArrayList<>();
        try (CSVParser parser = csvParser(reader)) {
            for (CSVRecord record : parser) {
                BigDecimal min = parseAmount(record, getColumn(record, "min_amount", "salary_min", "compensation_min"));
                BigDecimal max = parseAmount(record, getColumn(record, "max_amount", "salary_max", "compensation_max"));
                Compensation compensation = min == null && max == null
                    ? null
                    : new Compensation(
                        min,
                        max,
                        getColumn(record, "currency", "salary_currency"),
                        getColumn(record, "interval", "salary_interval", "pay_period")
                    );
                records.add(new RawJobRecord(
                    getColumn(record, "source_platform", "platform", "site"),
                    getColumn(record, "scrape_run_id", "run_id"),
                    getColumn(record, "title", "job_title"),
                    getColumn(record, "company", "company_name"),
                    getColumn(record, "company_domain", "company_url", "domain"),
                    getColumn(record, "company_size", "company_num_employees"),
                    getColumn(record, "location"),
                    getColumn(record, "description"),
                    parseDate(record, getColumn(record, "posted_date", "date_posted")),
                    compensation,
                    getColumn(record, "external_id", "job_id", "id"),
                    getColumn(record, "posting_url", "job_url", "url"),
                    parseInstant(record, getColumn(record, "observed_at")),
                    getColumn(record, "job_type", "employment_type")
                ));
            }
        }
        return records;
    }

    private CSVParser csvParser(Reader reader) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreSurroundingSpaces(true)
            .build();
        return format.parse(reader);
    }

    private String getColumn(CSVRecord record, String... names) {
        Map<String, String> values = record.toMap();
        for (String name : names) {
            for (Map.Entry<String, String> entry : values.entrySet()) {
                String header = entry.getKey();
                if (header == null) {
                    continue;
                }
                if (header.trim().equalsIgnoreCase(name)) {
                    String value = entry.getValue() == null ? "" : entry.getValue().trim();
                    return value.isEmpty() ? null : value;
                }
            }
        }
        return null;
    }

    private BigDecimal parseAmount(CSVRecord record, String raw) {
        if (raw == null) {
            return null;
        }
        try {
            return new BigDecimal(raw.replace(",", "").replace("$", "").trim());
        } catch (NumberFormatException e) {
            log.debug("csv row {} has unparseable amount '{}'", record.getRecordNumber(), raw);
            return null;
        }
    }

    private LocalDate parseDate(CSVRecord record, String raw) {
        if (raw == null) {
            return null;
        }
        try {
            return LocalDate.parse(raw.length() > 10 ? raw.substring(0, 10) : raw);
        } catch (DateTimeParseException e) {
            log.debug("csv row {} has unparseable date '{}'", record.getRecordNumber(), raw);
            return null;
        }
    }

    private Instant parseInstant(CSVRecord record, String raw) {
        if (raw == null) {
            return null;
        }
        try {
            return Instant.parse(raw);
        } catch (DateTimeParseException e) {
            try {
                return OffsetDateTime.parse(raw).toInstant();
            } catch (DateTimeParseException ignored) {
                log.debug("csv row {} has unparseable observed_at '{}'", record.getRecordNumber(), raw);
                return null;
            }
        }
    }
}
