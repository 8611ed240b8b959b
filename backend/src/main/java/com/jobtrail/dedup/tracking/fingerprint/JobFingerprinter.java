package com.jobtrail.dedup.tracking.fingerprint;

import com.jobtrail.dedup.tracking.model.Fingerprint;
import com.jobtrail.dedup.tracking.model.NormalizedJobView;
import com.jobtrail.dedup.tracking.util.HashUtils;
import org.springframework.stereotype.Component;

/**
 * Identity hash of a normalized posting. The hashed tuple is
 * (normalized title, canonical company id, canonical location id, compensation bucket key),
 * versioned so a future change of the tuple cannot collide with stored fingerprints.
 */
@Component
public class JobFingerprinter {
    static final String FINGERPRINT_VERSION = "job-v1";

    public Fingerprint fingerprint(NormalizedJobView view, long canonicalCompanyId, long canonicalLocationId) {
        return new Fingerprint(HashUtils.sha256HexOfFields(
            FINGERPRINT_VERSION,
            view.normalizedTitle(),
            Long.toString(canonicalCompanyId),
            Long.toString(canonicalLocationId),
            view.compensation().key()
        ));
    }

    /**
     * Corroborating signal for fuzzy matches only; null when the posting has no description.
     */
    public String descriptionFingerprint(NormalizedJobView view) {
        String text = view.descriptionText();
        if (text == null || text.isBlank()) {
            return null;
        }
        return HashUtils.sha256Hex(text);
    }

    public String matchScopeKey(long canonicalCompanyId, long canonicalLocationId) {
        return canonicalCompanyId + ":" + canonicalLocationId;
    }
}
