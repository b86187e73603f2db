package com.williamcallahan.research_engine.service.merge;

import com.williamcallahan.research_engine.model.WebHit;
import com.williamcallahan.research_engine.util.ValidationUtils;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Removes repeated web hits by exact URL. The seen-set is shared across all groups, so a URL
 * claimed by an earlier group (e.g. datasets) is dropped from later ones (e.g. tools).
 */
public final class WebHitDeduplicator {

    private WebHitDeduplicator() {
    }

    /**
     * @param groups hit lists in priority order
     * @return one list per input group, each keeping first-seen hits in their original order;
     *         hits without a URL are dropped
     */
    public static List<List<WebHit>> dedupeByUrl(List<List<WebHit>> groups) {
        Set<String> seen = new HashSet<>();
        List<List<WebHit>> result = new ArrayList<>(groups.size());
        for (List<WebHit> group : groups) {
            List<WebHit> kept = new ArrayList<>();
            if (group != null) {
                for (WebHit hit : group) {
                    if (hit == null || !ValidationUtils.hasText(hit.url())) {
                        continue;
                    }
                    if (seen.add(hit.url())) {
                        kept.add(hit);
                    }
                }
            }
            result.add(kept);
        }
        return result;
    }
}
