package com.jobtrail.dedup.tracking.service;

import com.jobtrail.dedup.tracking.model.CanonicalCompany;
import com.jobtrail.dedup.tracking.model.CanonicalLocation;
import com.jobtrail.dedup.tracking.model.CompanyResolution;
import com.jobtrail.dedup.tracking.model.NormalizedJobView;
import com.jobtrail.dedup.tracking.model.ParsedLocation;
import com.jobtrail.dedup.tracking.normalize.LocationParser;
import com.jobtrail.dedup.tracking.persistence.EntityJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lookup-or-create of canonical companies and locations on their exact normalized identity.
 * Each statement commits on its own, so a created entity is visible to every other worker
 * before any tracked job references it.
 */
@Service
public class EntityResolverService {
    private static final Logger log = LoggerFactory.getLogger(EntityResolverService.class);
    private static final String NO_DOMAIN = "";
    private static final Pattern FIRST_NUMBER = Pattern.compile("(\\d[\\d,]*)");
    private static final Map<String, Pattern> INDUSTRY_KEYWORDS = new LinkedHashMap<>();

    static {
        INDUSTRY_KEYWORDS.put("Technology", keywords("software", "tech", "startup", "saas", "cloud", "ai", "machine learning"));
        INDUSTRY_KEYWORDS.put("Healthcare", keywords("healthcare", "medical", "hospital", "clinic", "pharmaceutical"));
        INDUSTRY_KEYWORDS.put("Finance", keywords("finance", "banking", "investment", "fintech", "trading"));
        INDUSTRY_KEYWORDS.put("Education", keywords("education", "university", "school", "teaching", "academic"));
        INDUSTRY_KEYWORDS.put("Retail", keywords("retail", "ecommerce", "store", "shopping", "consumer"));
        INDUSTRY_KEYWORDS.put("Manufacturing", keywords("manufacturing", "factory", "production", "automotive"));
        INDUSTRY_KEYWORDS.put("Consulting", keywords("consulting", "advisory", "professional services"));
    }

    private final EntityJdbcRepository repository;
    private final Clock clock;

    public EntityResolverService(EntityJdbcRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    public CompanyResolution resolveCompany(String normalizedName, String domain) {
        return resolveCompany(normalizedName, domain, normalizedName, null, null, clock.instant());
    }

    public CompanyResolution resolveCompany(NormalizedJobView view) {
        return resolveCompany(
            view.companyName(),
            view.companyDomain(),
            view.companyDisplayName(),
            guessIndustry(view.descriptionText()),
            sizeBucket(view.companySize()),
            view.observedAt()
        );
    }

    CompanyResolution resolveCompany(
        String normalizedName,
        String domain,
        String displayName,
        String industry,
        String sizeBucket,
        Instant seenAt
    ) {
        if (normalizedName == null || normalizedName.isBlank()) {
            throw new IllegalArgumentException("normalized company name is required");
        }
        String identityDomain = domain == null || domain.isBlank() ? NO_DOMAIN : domain;

        CanonicalCompany existing = repository.findCompany(normalizedName, identityDomain);
        if (existing != null) {
            repository.touchCompany(existing.id(), seenAt, industry, sizeBucket);
            return new CompanyResolution(existing, CompanyResolution.Confidence.EXACT);
        }

        if (NO_DOMAIN.equals(identityDomain)) {
            List<CanonicalCompany> sameName = repository.findCompaniesByName(normalizedName);
            if (sameName.size() == 1) {
                CanonicalCompany only = sameName.get(0);
                repository.touchCompany(only.id(), seenAt, industry, sizeBucket);
                return new CompanyResolution(only, CompanyResolution.Confidence.NAME_ONLY);
            }
        }

        boolean created = repository.insertCompanyIfAbsent(
            normalizedName,
            identityDomain,
            displayName == null || displayName.isBlank() ? normalizedName : displayName,
            industry,
            sizeBucket,
            seenAt
        );
        CanonicalCompany company = repository.findCompany(normalizedName, identityDomain);
        if (company == null) {
            throw new ResolutionConflictException("Company " + normalizedName + " vanished after create");
        }
        if (created) {
            log.info("Created canonical company id={} name={} domain={}", company.id(), normalizedName, identityDomain);
            return new CompanyResolution(company, CompanyResolution.Confidence.CREATED);
        }
        repository.touchCompany(company.id(), seenAt, industry, sizeBucket);
        return new CompanyResolution(company, CompanyResolution.Confidence.EXACT);
    }

    public CanonicalLocation resolveLocation(String city, String region, String country) {
        String identityCity = city == null ? "" : city;
        String identityRegion = region == null ? "" : region;
        String identityCountry = country == null || country.isBlank() ? ParsedLocation.UNKNOWN_COUNTRY : country;

        CanonicalLocation existing = repository.findLocation(identityCity, identityRegion, identityCountry);
        if (existing != null) {
            return existing;
        }
        boolean created = repository.insertLocationIfAbsent(
            identityCity,
            identityRegion,
            identityCountry,
            LocationParser.regionGroup(identityCountry),
            clock.instant()
        );
        CanonicalLocation location = repository.findLocation(identityCity, identityRegion, identityCountry);
        if (location == null) {
            throw new ResolutionConflictException(
                "Location " + identityCity + "/" + identityRegion + "/" + identityCountry + " vanished after create"
            );
        }
        if (created) {
            log.debug("Created canonical location id={} {}/{}/{}", location.id(), identityCity, identityRegion, identityCountry);
        }
        return location;
    }

    public CanonicalLocation resolveLocation(ParsedLocation parsed) {
        return resolveLocation(parsed.city(), parsed.region(), parsed.country());
    }

    static String guessIndustry(String descriptionText) {
        if (descriptionText == null || descriptionText.isBlank()) {
            return null;
        }
        for (Map.Entry<String, Pattern> entry : INDUSTRY_KEYWORDS.entrySet()) {
            if (entry.getValue().matcher(descriptionText).find()) {
                return entry.getKey();
            }
        }
        return null;
    }

    /**
     * Buckets a raw head-count string ("51-200", "1,001 to 5,000 employees", "10000+")
     * by its first number.
     */
    static String sizeBucket(String rawSize) {
        if (rawSize == null || rawSize.isBlank()) {
            return null;
        }
        Matcher matcher = FIRST_NUMBER.matcher(rawSize);
        if (!matcher.find()) {
            return null;
        }
        long employees;
        try {
            employees = Long.parseLong(matcher.group(1).replace(",", ""));
        } catch (NumberFormatException e) {
            return null;
        }
        if (employees <= 10) {
            return "1-10";
        }
        if (employees <= 50) {
            return "11-50";
        }
        if (employees <= 200) {
            return "51-200";
        }
        if (employees <= 500) {
            return "201-500";
        }
        if (employees <= 1000) {
            return "501-1000";
        }
        if (employees <= 5000) {
            return "1001-5000";
        }
        return "5001+";
    }

    private static Pattern keywords(String... words) {
        StringBuilder pattern = new StringBuilder("\\b(?:");
        for (int i = 0; i < words.length; i++) {
            if (i > 0) {
                pattern.append('|');
            }
            pattern.append(Pattern.quote(words[i]));
        }
        return Pattern.compile(pattern.append(")\\b").toString());
    }
}
