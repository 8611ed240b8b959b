package com.jobtrail.dedup.tracking.api;

import com.jobtrail.dedup.tracking.csv.TrackedJobCsvWriter;
import com.jobtrail.dedup.tracking.model.BatchSummary;
import com.jobtrail.dedup.tracking.model.IngestionRunStatus;
import com.jobtrail.dedup.tracking.model.JobAnalytics;
import com.jobtrail.dedup.tracking.model.RawJobRecord;
import com.jobtrail.dedup.tracking.model.StatusResponse;
import com.jobtrail.dedup.tracking.model.TrackedJobFilter;
import com.jobtrail.dedup.tracking.model.TrackedJobPage;
import com.jobtrail.dedup.tracking.model.TrackedJobView;
import com.jobtrail.dedup.tracking.normalize.JobNormalizer;
import com.jobtrail.dedup.tracking.service.IngestionBatchService;
import com.jobtrail.dedup.tracking.service.TrackedJobQueryService;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static org.springframework.http.HttpStatus.BAD_REQUEST;
import static org.springframework.http.HttpStatus.NOT_FOUND;

@RestController
@RequestMapping("/api")
public class TrackingController {
    private final IngestionBatchService batchService;
    private final TrackedJobQueryService queryService;
    private final TrackedJobCsvWriter csvWriter;

    public TrackingController(
        IngestionBatchService batchService,
        TrackedJobQueryService queryService,
        TrackedJobCsvWriter csvWriter
    ) {
        this.batchService = batchService;
        this.queryService = queryService;
        this.csvWriter = csvWriter;
    }

    @PostMapping("/batches")
    public BatchSummary processBatch(@RequestBody BatchSubmitRequest request) {
        BatchSubmitRequest body = requireBody(request);
        return batchService.processBatch(body.scrapeRunId(), body.sourcePlatform(), records(body));
    }

    @PostMapping("/batches/async")
    public ResponseEntity<Map<String, Object>> submitBatch(@RequestBody BatchSubmitRequest request) {
        BatchSubmitRequest body = requireBody(request);
        String scrapeRunId = batchService.submitAsync(body.scrapeRunId(), body.sourcePlatform(), records(body));
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("scrapeRunId", scrapeRunId);
        response.put("status", "QUEUED");
        response.put("records", records(body).size());
        return ResponseEntity.accepted().body(response);
    }

    @PostMapping("/batches/{scrapeRunId}/cancel")
    public ResponseEntity<Map<String, Object>> cancelBatch(@PathVariable("scrapeRunId") String scrapeRunId) {
        if (!batchService.cancel(scrapeRunId)) {
            throw new ResponseStatusException(NOT_FOUND, "No active ingestion run " + scrapeRunId);
        }
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("scrapeRunId", scrapeRunId);
        response.put("cancelRequested", true);
        return ResponseEntity.accepted().body(response);
    }

    @GetMapping("/batches/{scrapeRunId}")
    public IngestionRunStatus getBatch(@PathVariable("scrapeRunId") String scrapeRunId) {
        IngestionRunStatus run = batchService.findRun(scrapeRunId);
        if (run == null) {
            throw new ResponseStatusException(NOT_FOUND, "Unknown ingestion run " + scrapeRunId);
        }
        return run;
    }

    @GetMapping("/jobs")
    public TrackedJobPage getJobs(
        @RequestParam(name = "companyId", required = false) Long companyId,
        @RequestParam(name = "company", required = false) String company,
        @RequestParam(name = "locationId", required = false) Long locationId,
        @RequestParam(name = "country", required = false) String country,
        @RequestParam(name = "evergreen", required = false) Boolean evergreen,
        @RequestParam(name = "minRepostCount", required = false) Integer minRepostCount,
        @RequestParam(name = "remote", required = false) Boolean remote,
        @RequestParam(name = "jobType", required = false) String jobType,
        @RequestParam(name = "category", required = false) String category,
        @RequestParam(name = "seenFrom", required = false) String seenFrom,
        @RequestParam(name = "seenTo", required = false) String seenTo,
        @RequestParam(name = "cursor", required = false) String cursor,
        @RequestParam(name = "limit", required = false) Integer limit
    ) {
        TrackedJobFilter filter = filter(
            companyId, company, locationId, country, evergreen, minRepostCount, remote, jobType, category, seenFrom, seenTo
        );
        return queryService.query(filter, cursor, limit);
    }

    @GetMapping(value = "/jobs", params = "format=csv", produces = "text/csv")
    public ResponseEntity<String> exportJobs(
        @RequestParam(name = "companyId", required = false) Long companyId,
        @RequestParam(name = "company", required = false) String company,
        @RequestParam(name = "locationId", required = false) Long locationId,
        @RequestParam(name = "country", required = false) String country,
        @RequestParam(name = "evergreen", required = false) Boolean evergreen,
        @RequestParam(name = "minRepostCount", required = false) Integer minRepostCount,
        @RequestParam(name = "remote", required = false) Boolean remote,
        @RequestParam(name = "jobType", required = false) String jobType,
        @RequestParam(name = "category", required = false) String category,
        @RequestParam(name = "seenFrom", required = false) String seenFrom,
        @RequestParam(name = "seenTo", required = false) String seenTo,
        @RequestParam(name = "cursor", required = false) String cursor,
        @RequestParam(name = "limit", required = false) Integer limit
    ) {
        TrackedJobFilter filter = filter(
            companyId, company, locationId, country, evergreen, minRepostCount, remote, jobType, category, seenFrom, seenTo
        );
        TrackedJobPage page = queryService.query(filter, cursor, limit);
        StringWriter out = new StringWriter();
        try {
            csvWriter.write(page.items(), out);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        ResponseEntity.BodyBuilder response = ResponseEntity.ok()
            .contentType(MediaType.parseMediaType("text/csv"))
            .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=tracked-jobs.csv");
        if (page.nextCursor() != null) {
            response.header("X-Next-Cursor", page.nextCursor());
        }
        return response.body(out.toString());
    }

    @GetMapping("/jobs/{fingerprint}")
    public TrackedJobView getJob(@PathVariable("fingerprint") String fingerprint) {
        TrackedJobView job = queryService.findByFingerprint(fingerprint);
        if (job == null) {
            throw new ResponseStatusException(NOT_FOUND, "Unknown job " + fingerprint);
        }
        return job;
    }

    @GetMapping("/analytics")
    public JobAnalytics getAnalytics(
        @RequestParam(name = "companyId", required = false) Long companyId,
        @RequestParam(name = "company", required = false) String company,
        @RequestParam(name = "locationId", required = false) Long locationId,
        @RequestParam(name = "country", required = false) String country,
        @RequestParam(name = "evergreen", required = false) Boolean evergreen,
        @RequestParam(name = "minRepostCount", required = false) Integer minRepostCount,
        @RequestParam(name = "remote", required = false) Boolean remote,
        @RequestParam(name = "jobType", required = false) String jobType,
        @RequestParam(name = "category", required = false) String category,
        @RequestParam(name = "seenFrom", required = false) String seenFrom,
        @RequestParam(name = "seenTo", required = false) String seenTo,
        @RequestParam(name = "topCompanies", required = false) Integer topCompanies
    ) {
        TrackedJobFilter filter = filter(
            companyId, company, locationId, country, evergreen, minRepostCount, remote, jobType, category, seenFrom, seenTo
        );
        return queryService.analytics(filter, topCompanies);
    }

    @GetMapping("/status")
    public StatusResponse status() {
        return queryService.status();
    }

    private TrackedJobFilter filter(
        Long companyId,
        String company,
        Long locationId,
        String country,
        Boolean evergreen,
        Integer minRepostCount,
        Boolean remote,
        String jobType,
        String category,
        String seenFrom,
        String seenTo
    ) {
        String normalizedCompany = company == null || company.isBlank() ? null : JobNormalizer.normalizeCompanyName(company);
        String normalizedCountry = country == null || country.isBlank() ? null : country.trim().toLowerCase(Locale.ROOT);
        String normalizedCategory = category == null || category.isBlank() ? null : category.trim();
        return new TrackedJobFilter(
            companyId,
            normalizedCompany,
            locationId,
            normalizedCountry,
            evergreen,
            minRepostCount,
            remote,
            JobNormalizer.normalizeJobType(jobType),
            normalizedCategory,
            parseInstant("seenFrom", seenFrom),
            parseInstant("seenTo", seenTo)
        );
    }

    private Instant parseInstant(String name, String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(raw.trim());
        } catch (DateTimeParseException e) {
            throw new ResponseStatusException(BAD_REQUEST, name + " must be an ISO-8601 instant");
        }
    }

    private static BatchSubmitRequest requireBody(BatchSubmitRequest request) {
        if (request == null || request.scrapeRunId() == null || request.scrapeRunId().isBlank()) {
            throw new ResponseStatusException(BAD_REQUEST, "scrapeRunId is required");
        }
        return request;
    }

    private static List<RawJobRecord> records(BatchSubmitRequest request) {
        return request.records() == null ? List.of() : request.records();
    }
}
