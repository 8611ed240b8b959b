package com.jobtrail.dedup.tracking.service;

import com.jobtrail.dedup.tracking.model.MatchType;
import com.jobtrail.dedup.tracking.model.MergeOutcome;
import com.jobtrail.dedup.tracking.model.RawJobRecord;
import com.jobtrail.dedup.tracking.model.ScrapeRunContext;
import com.jobtrail.dedup.tracking.model.TrackedJobFilter;
import com.jobtrail.dedup.tracking.model.TrackedJobView;
import com.jobtrail.dedup.tracking.normalize.JobNormalizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

@SpringBootTest(properties = "tracking.fuzzy-candidate-page-size=3")
@ActiveProfiles("test")
@Transactional
class LargeScopeMatchingTest {
    private static final Instant T0 = Instant.parse("2026-06-01T07:00:00Z");
    private static final List<String> NEWER_TITLES = List.of(
        "Product Manager",
        "Backend Developer",
        "Graphic Designer",
        "Sales Associate",
        "Account Executive",
        "Nurse Practitioner",
        "Warehouse Supervisor",
        "Registered Pharmacist"
    );

    @Autowired
    private TrackingMergeService mergeService;

    @Autowired
    private TrackedJobQueryService queryService;

    private String company;

    @BeforeEach
    void setUp() {
        company = "Big Scope " + UUID.randomUUID().toString().substring(0, 6);
    }

    @Test
    void seniorityVariantOfOldJobMergesBehindManyNewerJobs() {
        MergeOutcome original = ingest("Senior Data Engineer", "in-0", T0);
        for (int i = 0; i < NEWER_TITLES.size(); i++) {
            ingest(NEWER_TITLES.get(i), "in-" + (i + 1), T0.plusSeconds(60L * (i + 1)));
        }

        MergeOutcome variant = ingest("Data Engineer Sr", "in-99", T0.plusSeconds(3600));

        assertEquals(MergeOutcome.Type.MERGED, variant.type());
        assertEquals(MatchType.FUZZY, variant.matchType());
        assertEquals(original.jobFingerprint(), variant.jobFingerprint());
        List<TrackedJobView> jobs = queryService.query(byCompany(), null, 100).items();
        assertThat(jobs).hasSize(NEWER_TITLES.size() + 1);
        assertThat(jobs).extracting(TrackedJobView::title).doesNotContain("data engineer sr");
    }

    private TrackedJobFilter byCompany() {
        return new TrackedJobFilter(
            null,
            JobNormalizer.normalizeCompanyName(company),
            null,
            null,
            null,
            null,
            null,
            null,
            null,
            null,
            null
        );
    }

    private MergeOutcome ingest(String title, String externalId, Instant observedAt) {
        RawJobRecord record = new RawJobRecord(
            "indeed",
            null,
            title,
            company,
            null,
            null,
            "Chicago, IL",
            null,
            null,
            null,
            externalId,
            null,
            observedAt,
            null
        );
        return mergeService.ingest(record, new ScrapeRunContext("scope-run", "indeed", observedAt));
    }
}
