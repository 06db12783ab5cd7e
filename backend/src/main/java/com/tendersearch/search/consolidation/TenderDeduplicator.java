package com.tendersearch.search.consolidation;

import com.tendersearch.search.model.DuplicatePolicy;
import com.tendersearch.search.model.Tender;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Collapses tenders that describe the same opportunity. Two tenders match when their trimmed,
 * lower-cased title and organization are both equal; identifiers are never compared because
 * their formats differ between sources.
 *
 * <p>Output keeps input order minus the dropped duplicates. Degraded tenders are always kept.
 */
public final class TenderDeduplicator {
    private static final char KEY_SEPARATOR = '\u001f';

    private TenderDeduplicator() {
    }

    public static List<Tender> deduplicate(List<Tender> tenders) {
        return deduplicate(tenders, DuplicatePolicy.FIRST_SEEN);
    }

    public static List<Tender> deduplicate(List<Tender> tenders, DuplicatePolicy policy) {
        if (tenders == null || tenders.isEmpty()) {
            return List.of();
        }
        DuplicatePolicy effective = policy == null ? DuplicatePolicy.FIRST_SEEN : policy;
        Map<String, Integer> slotByKey = new HashMap<>();
        List<Tender> kept = new ArrayList<>();
        for (Tender tender : tenders) {
            if (tender == null) {
                continue;
            }
            if (tender.isDegraded()) {
                kept.add(tender);
                continue;
            }
            String key = duplicateKey(tender);
            Integer slot = slotByKey.get(key);
            if (slot == null) {
                slotByKey.put(key, kept.size());
                kept.add(tender);
            } else if (effective == DuplicatePolicy.MOST_COMPLETE && completeness(tender) > completeness(kept.get(slot))) {
                kept.set(slot, tender);
            }
        }
        return kept;
    }

    static String duplicateKey(Tender tender) {
        return normalize(tender.title()) + KEY_SEPARATOR + normalize(tender.organization());
    }

    static int completeness(Tender tender) {
        int populated = 0;
        populated += present(tender.id()) && !Tender.UNKNOWN_ID.equals(tender.id()) ? 1 : 0;
        populated += present(tender.title()) ? 1 : 0;
        populated += present(tender.description()) && !tender.description().equals(tender.title()) ? 1 : 0;
        populated += present(tender.organization()) ? 1 : 0;
        populated += tender.value().compareTo(BigDecimal.ZERO) > 0 ? 1 : 0;
        populated += tender.publishDate() != null ? 1 : 0;
        populated += tender.deadline() != null ? 1 : 0;
        populated += present(tender.country()) ? 1 : 0;
        populated += present(tender.city()) ? 1 : 0;
        populated += present(tender.url()) ? 1 : 0;
        return populated;
    }

    private static boolean present(String value) {
        return value != null && !value.isBlank();
    }

    private static String normalize(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }
}
