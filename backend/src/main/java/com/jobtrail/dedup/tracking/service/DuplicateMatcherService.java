package com.jobtrail.dedup.tracking.service;

import com.jobtrail.dedup.config.TrackingProperties;
import com.jobtrail.dedup.tracking.model.Fingerprint;
import com.jobtrail.dedup.tracking.model.MatchCandidate;
import com.jobtrail.dedup.tracking.model.MatchType;
import com.jobtrail.dedup.tracking.model.NormalizedJobView;
import com.jobtrail.dedup.tracking.model.TitleKey;
import com.jobtrail.dedup.tracking.model.TrackedJob;
import com.jobtrail.dedup.tracking.normalize.TitleNormalizer;
import com.jobtrail.dedup.tracking.persistence.TrackingJdbcRepository;
import com.jobtrail.dedup.tracking.util.TextSimilarity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Finds the tracked job an observation belongs to: exact fingerprint first, then the
 * best fuzzy title match among all jobs of the same canonical company and location whose
 * core title has as many words, scanned page by page.
 */
@Service
public class DuplicateMatcherService {
    private static final Logger log = LoggerFactory.getLogger(DuplicateMatcherService.class);
    static final double MIN_WORD_SIMILARITY = 0.7;

    private final TrackingJdbcRepository repository;
    private final TrackingProperties properties;

    public DuplicateMatcherService(TrackingJdbcRepository repository, TrackingProperties properties) {
        this.repository = repository;
        this.properties = properties;
    }

    public Optional<MatchCandidate> findCandidate(
        Fingerprint fingerprint,
        String descriptionFingerprint,
        NormalizedJobView view,
        long canonicalCompanyId,
        long canonicalLocationId
    ) {
        TrackedJob exact = repository.findByFingerprint(fingerprint.value());
        if (exact != null) {
            return Optional.of(new MatchCandidate(exact, MatchType.EXACT, 1.0));
        }

        List<String> coreTokens = view.title().coreTokens();
        if (coreTokens.isEmpty()) {
            return Optional.empty();
        }
        double threshold = properties.getFuzzyTitleSimilarityThreshold();
        double ceiling = descriptionFingerprint == null ? 1.0 : 1.0 + properties.getDescriptionMatchBonus();
        int pageSize = properties.getFuzzyCandidatePageSize();
        TrackedJob best = null;
        double bestScore = -1.0;
        int scanned = 0;
        TrackedJob after = null;
        // pages arrive newest first, so a strictly-greater check keeps the most recent on ties
        while (bestScore < ceiling) {
            List<TrackedJob> page = repository.findScopeCandidates(
                canonicalCompanyId,
                canonicalLocationId,
                coreTokens.size(),
                after,
                pageSize
            );
            for (TrackedJob candidate : page) {
                double score = score(view.title(), descriptionFingerprint, candidate);
                if (score >= threshold && score > bestScore) {
                    best = candidate;
                    bestScore = score;
                    if (bestScore >= ceiling) {
                        break;
                    }
                }
            }
            scanned += page.size();
            if (page.size() < pageSize) {
                break;
            }
            after = page.get(page.size() - 1);
        }
        if (best == null) {
            log.debug("No match for '{}' among {} candidates in scope {}:{}",
                view.normalizedTitle(), scanned, canonicalCompanyId, canonicalLocationId);
            return Optional.empty();
        }
        log.debug("Fuzzy match '{}' -> '{}' ({}) score={}",
            view.normalizedTitle(), best.normalizedTitle(), best.jobFingerprint(), bestScore);
        return Optional.of(new MatchCandidate(
            best.withSources(repository.findSources(best.id())),
            MatchType.FUZZY,
            bestScore
        ));
    }

    double score(TitleKey incoming, String descriptionFingerprint, TrackedJob candidate) {
        double similarity = titleSimilarity(incoming, TitleNormalizer.key(candidate.normalizedTitle()));
        if (similarity <= 0.0) {
            return 0.0;
        }
        if (descriptionFingerprint != null && descriptionFingerprint.equals(candidate.descriptionFingerprint())) {
            similarity += properties.getDescriptionMatchBonus();
        }
        return similarity;
    }

    /**
     * 1.0 for seniority variants of the same core title and 0 for two different explicit
     * seniority levels. Otherwise the core titles are compared word by word: a different
     * word count, or any word pair below {@link #MIN_WORD_SIMILARITY}, scores 0, and the
     * rest score by their summed edit distance.
     */
    public static double titleSimilarity(TitleKey a, TitleKey b) {
        if (a == null || b == null) {
            return 0.0;
        }
        if (a.level().isQualified() && b.level().isQualified() && a.level() != b.level()) {
            return 0.0;
        }
        if (a.core().equals(b.core())) {
            return 1.0;
        }
        return TextSimilarity.tokenEditSimilarity(a.coreTokens(), b.coreTokens(), MIN_WORD_SIMILARITY);
    }
}
