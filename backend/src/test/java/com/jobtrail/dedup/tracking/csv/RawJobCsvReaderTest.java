package com.jobtrail.dedup.tracking.csv;

import com.jobtrail.dedup.tracking.model.RawJobRecord;
import org.junit.jupiter.api.Test;

import java.io.StringReader;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RawJobCsvReaderTest {
    private final RawJobCsvReader reader = new RawJobCsvReader();

    @Test
    void readsFixtureKeepingUnparseableRows() throws Exception {
        Path fixture = Path.of(getClass().getResource("/fixtures/raw-jobs.csv").toURI());

        List<RawJobRecord> records = reader.read(fixture);

        assertEquals(4, records.size());
        RawJobRecord first = records.get(0);
        assertEquals("indeed", first.sourcePlatform());
        assertEquals("in-100", first.externalId());
        assertEquals("Acme, Inc.", first.companyName());
        assertEquals("1,200", first.companySize());
        assertEquals(LocalDate.of(2026, 3, 1), first.postedDate());
        assertEquals(new BigDecimal("150000"), first.compensation().minAmount());
        assertEquals("https://indeed.example/in-100", first.postingUrl());
        assertEquals(Instant.parse("2026-03-02T10:00:00Z"), first.observedAt());

        assertNull(records.get(2).title());
        assertNull(records.get(2).compensation());

        RawJobRecord last = records.get(3);
        assertNull(last.postedDate());
        assertNull(last.observedAt());
        assertNull(last.companyDomain());
        assertEquals("GBP", last.compensation().currency());
        assertEquals("hour", last.compensation().interval());
    }

    @Test
    void acceptsAlternateColumnNames() throws Exception {
        String csv = "site,job_id,job_title,company_name,job_url,min_amount,pay_period,date_posted,observed_at\n"
            + "indeed,abc,QA Engineer,Initech,https://x.example/abc,$85000,yearly,2026-02-01T00:00:00,"
            + "2026-02-02T08:00:00+02:00\n";

        List<RawJobRecord> records = reader.read(new StringReader(csv));

        assertEquals(1, records.size());
        RawJobRecord record = records.get(0);
        assertEquals("indeed", record.sourcePlatform());
        assertEquals("abc", record.externalId());
        assertEquals("QA Engineer", record.title());
        assertEquals("Initech", record.companyName());
        assertEquals("https://x.example/abc", record.postingUrl());
        assertEquals(new BigDecimal("85000"), record.compensation().minAmount());
        assertNull(record.compensation().maxAmount());
        assertEquals("yearly", record.compensation().interval());
        assertEquals(LocalDate.of(2026, 2, 1), record.postedDate());
        assertEquals(Instant.parse("2026-02-02T06:00:00Z"), record.observedAt());
    }

    @Test
    void headerOnlyFileIsEmpty() throws Exception {
        assertTrue(reader.read(new StringReader("title,company,location\n")).isEmpty());
    }
}
