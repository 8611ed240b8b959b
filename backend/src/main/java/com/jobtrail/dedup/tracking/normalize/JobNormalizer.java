package com.jobtrail.dedup.tracking.normalize;

import com.jobtrail.dedup.config.TrackingProperties;
import com.jobtrail.dedup.tracking.model.CompensationBucket;
import com.jobtrail.dedup.tracking.model.NormalizedJobView;
import com.jobtrail.dedup.tracking.model.ParsedLocation;
import com.jobtrail.dedup.tracking.model.RawJobRecord;
import com.jobtrail.dedup.tracking.model.TitleKey;
import org.jsoup.Jsoup;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

@Component
public class JobNormalizer {
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern TRAILING_PUNCTUATION = Pattern.compile("[\\s,.;:!\\-]+$");
    private static final Pattern REMOTE_TITLE = Pattern.compile("\\b(?:remote|work from home|wfh)\\b");
    private static final Pattern NON_LETTERS = Pattern.compile("[^a-z]+");
    private static final Map<String, String> JOB_TYPES = Map.ofEntries(
        Map.entry("fulltime", "full_time"),
        Map.entry("permanent", "full_time"),
        Map.entry("parttime", "part_time"),
        Map.entry("contract", "contract"),
        Map.entry("contractor", "contract"),
        Map.entry("freelance", "contract"),
        Map.entry("internship", "internship"),
        Map.entry("intern", "internship"),
        Map.entry("temporary", "temporary"),
        Map.entry("temp", "temporary"),
        Map.entry("seasonal", "temporary")
    );
    private static final Set<String> LEGAL_SUFFIXES = Set.of(
        "inc", "incorporated", "corp", "corporation", "ltd", "limited", "llc", "llp", "lp",
        "co", "company", "gmbh", "plc", "ag", "sa"
    );

    private final TrackingProperties properties;
    private final CompensationNormalizer compensationNormalizer;

    public JobNormalizer(TrackingProperties properties) {
        this.properties = properties;
        this.compensationNormalizer = new CompensationNormalizer(properties.getCurrency());
    }

    /**
     * @param defaultObservedAt used when the record carries no observation time of its own
     * @throws NormalizationException when title, company or platform is missing
     */
    public NormalizedJobView normalize(RawJobRecord record, Instant defaultObservedAt) {
        if (record == null) {
            throw new NormalizationException("record", "record is required");
        }
        if (isBlank(record.sourcePlatform())) {
            throw new NormalizationException("platform", "source platform is required");
        }
        if (isBlank(record.title())) {
            throw new NormalizationException("title", "title is required");
        }
        if (isBlank(record.companyName())) {
            throw new NormalizationException("company", "company name is required");
        }

        String normalizedTitle = TitleNormalizer.normalize(record.title());
        if (normalizedTitle.isEmpty()) {
            throw new NormalizationException("title", "title is empty after normalization");
        }
        String companyName = normalizeCompanyName(record.companyName());
        if (companyName.isEmpty()) {
            throw new NormalizationException("company", "company name is empty after normalization");
        }

        TitleKey titleKey = TitleNormalizer.key(normalizedTitle);
        ParsedLocation location = LocationParser.parse(record.location());
        CompensationBucket compensation = compensationNormalizer.bucket(record.compensation());
        boolean remote = location.remote() || REMOTE_TITLE.matcher(record.title().toLowerCase(Locale.ROOT)).find();
        Instant observedAt = record.observedAt() != null ? record.observedAt() : defaultObservedAt;
        if (observedAt == null) {
            throw new NormalizationException("observed_at", "observation time is required");
        }

        return new NormalizedJobView(
            titleKey,
            collapse(record.title()),
            companyName,
            collapse(record.companyName()),
            normalizeDomain(record.companyDomain()),
            trimToNull(record.companySize()),
            location,
            descriptionText(record.description()),
            compensation,
            normalizeJobType(record.jobType()),
            remote,
            record.sourcePlatform().trim().toLowerCase(Locale.ROOT),
            trimToNull(record.externalId()),
            trimToNull(record.postingUrl()),
            record.postedDate(),
            observedAt.truncatedTo(ChronoUnit.MILLIS)
        );
    }

    public static String normalizeCompanyName(String raw) {
        if (raw == null) {
            return "";
        }
        String original = stripTrailingPunctuation(collapse(raw.toLowerCase(Locale.ROOT)));
        String value = original;
        boolean stripped = true;
        while (stripped) {
            stripped = false;
            int lastSpace = value.lastIndexOf(' ');
            if (lastSpace < 0) {
                break;
            }
            String lastToken = value.substring(lastSpace + 1).replace(".", "");
            if (LEGAL_SUFFIXES.contains(lastToken)) {
                value = stripTrailingPunctuation(value.substring(0, lastSpace));
                stripped = true;
            }
        }
        return value.isEmpty() ? original : value;
    }

    /**
     * One of full_time, part_time, contract, internship or temporary; "other" for an
     * unrecognized value and null when none was given.
     */
    public static String normalizeJobType(String raw) {
        if (isBlank(raw)) {
            return null;
        }
        String key = NON_LETTERS.matcher(raw.toLowerCase(Locale.ROOT)).replaceAll("");
        if (key.isEmpty()) {
            return null;
        }
        return JOB_TYPES.getOrDefault(key, "other");
    }

    /**
     * Bare host name: no scheme, "www.", port or path. Returns null when nothing usable remains.
     */
    public static String normalizeDomain(String raw) {
        if (isBlank(raw)) {
            return null;
        }
        String value = raw.trim().toLowerCase(Locale.ROOT);
        int scheme = value.indexOf("://");
        if (scheme >= 0) {
            value = value.substring(scheme + 3);
        }
        int slash = value.indexOf('/');
        if (slash >= 0) {
            value = value.substring(0, slash);
        }
        int colon = value.indexOf(':');
        if (colon >= 0) {
            value = value.substring(0, colon);
        }
        if (value.startsWith("www.")) {
            value = value.substring(4);
        }
        while (value.endsWith(".")) {
            value = value.substring(0, value.length() - 1);
        }
        return value.isBlank() ? null : value;
    }

    private String descriptionText(String description) {
        if (isBlank(description)) {
            return null;
        }
        String plain = collapse(Jsoup.parse(description).text().toLowerCase(Locale.ROOT));
        if (plain.isEmpty()) {
            return null;
        }
        int limit = properties.getDescriptionFingerprintChars();
        return plain.length() <= limit ? plain : plain.substring(0, limit).trim();
    }

    private static String stripTrailingPunctuation(String value) {
        return TRAILING_PUNCTUATION.matcher(value).replaceAll("").trim();
    }

    private static String collapse(String value) {
        return value == null ? "" : WHITESPACE.matcher(value.replace('\u00A0', ' ')).replaceAll(" ").trim();
    }

    private static String trimToNull(String value) {
        return isBlank(value) ? null : value.trim();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
