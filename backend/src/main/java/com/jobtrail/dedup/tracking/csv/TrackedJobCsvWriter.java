package com.jobtrail.dedup.tracking.csv;

import com.jobtrail.dedup.tracking.model.JobSource;
import com.jobtrail.dedup.tracking.model.TrackedJobView;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;
import java.util.List;
import java.util.stream.Collectors;

@Component
public class TrackedJobCsvWriter {
    static final String[] HEADER = {
        "job_fingerprint",
        "title",
        "display_title",
        "company_id",
        "company_name",
        "company_domain",
        "location_id",
        "city",
        "region",
        "country",
        "is_remote",
        "experience_level",
        "job_category",
        "job_type",
        "compensation_bucket",
        "first_seen_at",
        "last_seen_at",
        "days_active",
        "repost_count",
        "is_evergreen",
        "evergreen_score",
        "total_seen_count",
        "sites_posted_count",
        "platforms"
    };

    public void write(List<TrackedJobView> jobs, Writer writer) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setHeader(HEADER)
            .build();
        CSVPrinter printer = new CSVPrinter(writer, format);
        for (TrackedJobView job : jobs) {
            printer.printRecord(
                job.jobFingerprint(),
                job.title(),
                job.displayTitle(),
                job.companyId(),
                job.companyName(),
                job.companyDomain(),
                job.locationId(),
                job.city(),
                job.region(),
                job.country(),
                job.remote(),
                job.experienceLevel(),
                job.jobCategory(),
                job.jobType(),
                job.compensationBucket(),
                job.firstSeenAt(),
                job.lastSeenAt(),
                job.daysActive(),
                job.repostCount(),
                job.evergreen(),
                job.evergreenScore(),
                job.totalSeenCount(),
                job.sitesPostedCount(),
                platforms(job.sources())
            );
        }
        printer.flush();
    }

    private static String platforms(List<JobSource> sources) {
        if (sources == null || sources.isEmpty()) {
            return "";
        }
        return sources.stream().map(JobSource::platform).collect(Collectors.joining("|"));
    }
}
