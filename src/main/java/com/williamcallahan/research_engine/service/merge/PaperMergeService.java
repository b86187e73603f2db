/**
 * Folds paper results from a primary and a secondary provider into one deduplicated list
 *
 * @author William Callahan
 *
 * Features:
 * - Primary records are indexed first; a repeated key inside one provider keeps the first record
 * - Citation counts and abstracts from the secondary provider replace only absent or zero values
 * - Locators (url, pdf url, open-access url) and bibliographic gaps are filled only when missing
 * - Secondary records matching a primary key are tagged {@link Provenance#BOTH}, whatever their own tag
 * - A key first introduced by the secondary list keeps its first record
 * - Output is stably sorted by citation count, highest first, with missing counts as zero
 */

package com.williamcallahan.research_engine.service.merge;

import com.williamcallahan.research_engine.model.CanonicalRecord;
import com.williamcallahan.research_engine.model.Provenance;
import com.williamcallahan.research_engine.model.ProviderRecord;
import com.williamcallahan.research_engine.util.DoiUtils;
import com.williamcallahan.research_engine.util.ValidationUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Service
public class PaperMergeService {

    static final Comparator<CanonicalRecord> BY_CITATIONS_DESC =
        Comparator.comparingInt((CanonicalRecord r) -> r.getCitedByCount() != null ? r.getCitedByCount() : 0).reversed();

    /**
     * Merges two provider result lists. Pure: the inputs are not modified and the same inputs
     * always produce the same output.
     *
     * @param primary   records from the preferred provider
     * @param secondary records from the enriching provider
     * @return merged records, sorted by citation count descending
     */
    public List<CanonicalRecord> merge(List<ProviderRecord> primary, List<ProviderRecord> secondary) {
        Map<String, CanonicalRecord> index = new LinkedHashMap<>();
        Set<String> primaryKeys = new HashSet<>();

        for (ProviderRecord record : nullSafe(primary)) {
            String key = RecordCanonicalizer.dedupKey(record);
            if (key == null || index.containsKey(key)) {
                continue;
            }
            index.put(key, canonicalize(record));
            primaryKeys.add(key);
        }

        for (ProviderRecord record : nullSafe(secondary)) {
            String key = RecordCanonicalizer.dedupKey(record);
            if (key == null) {
                continue;
            }
            CanonicalRecord existing = index.get(key);
            if (existing == null) {
                index.put(key, canonicalize(record));
            } else if (primaryKeys.contains(key)) {
                absorb(existing, record);
                existing.setProvenance(Provenance.BOTH);
            }
        }

        List<CanonicalRecord> merged = new ArrayList<>(index.values());
        merged.sort(BY_CITATIONS_DESC);
        return merged;
    }

    private static CanonicalRecord canonicalize(ProviderRecord record) {
        CanonicalRecord canonical = CanonicalRecord.from(record);
        canonical.setDoi(DoiUtils.normalize(record.doi()));
        return canonical;
    }

    private static void absorb(CanonicalRecord target, ProviderRecord source) {
        if (ValidationUtils.isPositive(source.citationCount()) && !ValidationUtils.isPositive(target.getCitedByCount())) {
            target.setCitedByCount(source.citationCount());
        }
        if (ValidationUtils.isPositive(source.influentialCitationCount())
                && !ValidationUtils.isPositive(target.getInfluentialCitationCount())) {
            target.setInfluentialCitationCount(source.influentialCitationCount());
        }
        if (ValidationUtils.hasText(source.abstractText()) && !ValidationUtils.hasText(target.getAbstractText())) {
            target.setAbstractText(source.abstractText());
        }

        if (!ValidationUtils.hasText(target.getUrl())) {
            target.setUrl(ValidationUtils.nullIfBlank(source.url()));
        }
        if (!ValidationUtils.hasText(target.getPdfUrl())) {
            target.setPdfUrl(ValidationUtils.nullIfBlank(source.pdfUrl()));
        }
        if (!ValidationUtils.hasText(target.getOpenAccessUrl())) {
            target.setOpenAccessUrl(ValidationUtils.nullIfBlank(source.openAccessUrl()));
        }
        if (target.getDoi() == null) {
            target.setDoi(DoiUtils.normalize(source.doi()));
        }
        if (target.getYear() == null) {
            target.setYear(source.year());
        }
        if (!ValidationUtils.hasText(target.getVenue())) {
            target.setVenue(ValidationUtils.nullIfBlank(source.venue()));
        }
        if (ValidationUtils.isNullOrEmpty(target.getAuthors()) && !source.authors().isEmpty()) {
            target.setAuthors(new ArrayList<>(source.authors()));
        }
    }

    private static List<ProviderRecord> nullSafe(List<ProviderRecord> records) {
        return records != null ? records : List.of();
    }
}
