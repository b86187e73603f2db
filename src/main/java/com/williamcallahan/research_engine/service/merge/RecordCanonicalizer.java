package com.williamcallahan.research_engine.service.merge;

import com.williamcallahan.research_engine.model.CanonicalRecord;
import com.williamcallahan.research_engine.model.ProviderRecord;
import com.williamcallahan.research_engine.util.DoiUtils;
import com.williamcallahan.research_engine.util.TextUtils;

/**
 * Derives the dedup key that decides whether two provider records describe the same work.
 * The key is the normalized DOI when one exists, otherwise the normalized title key. A record
 * with neither has no key and is dropped from merged output.
 */
public final class RecordCanonicalizer {

    private RecordCanonicalizer() {
    }

    public static String dedupKey(ProviderRecord record) {
        return record == null ? null : dedupKey(record.doi(), record.title());
    }

    public static String dedupKey(CanonicalRecord record) {
        return record == null ? null : dedupKey(record.getDoi(), record.getTitle());
    }

    /**
     * @return the key, or {@code null} when both DOI and title normalize to nothing
     */
    public static String dedupKey(String doi, String title) {
        String normalizedDoi = DoiUtils.normalize(doi);
        if (normalizedDoi != null) {
            return normalizedDoi;
        }
        String titleKey = TextUtils.normalizeTitleKey(title);
        return titleKey.isEmpty() ? null : titleKey;
    }
}
