package com.williamcallahan.research_engine.service.merge;

import com.williamcallahan.research_engine.model.CanonicalRecord;
import com.williamcallahan.research_engine.model.Provenance;
import com.williamcallahan.research_engine.util.TextUtils;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Restores provenance on papers that came back from the text-generation collaborator, which
 * may rewrite or drop fields. Papers are matched to the merged set by normalized title key.
 */
public final class ProvenanceReattacher {

    private ProvenanceReattacher() {
    }

    /**
     * @param annotated papers returned by the collaborator
     * @param merged    the merged papers they were chosen from
     * @return copies of {@code annotated} with provenance and display source set; unmatched
     *         papers get the generic {@link Provenance#UNKNOWN_LABEL}
     */
    public static List<CanonicalRecord> reattach(List<CanonicalRecord> annotated, List<CanonicalRecord> merged) {
        Map<String, Provenance> byTitle = new HashMap<>();
        for (CanonicalRecord record : merged) {
            String key = TextUtils.normalizeTitleKey(record.getTitle());
            if (!key.isEmpty()) {
                byTitle.putIfAbsent(key, record.getProvenance());
            }
        }

        List<CanonicalRecord> result = new ArrayList<>(annotated.size());
        for (CanonicalRecord paper : annotated) {
            CanonicalRecord copy = paper.copy();
            Provenance provenance = byTitle.get(TextUtils.normalizeTitleKey(paper.getTitle()));
            copy.setProvenance(provenance);
            copy.setSource(provenance != null ? provenance.getDisplayLabel() : Provenance.UNKNOWN_LABEL);
            result.add(copy);
        }
        return result;
    }
}
