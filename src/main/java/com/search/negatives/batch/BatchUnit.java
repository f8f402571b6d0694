package com.search.negatives.batch;

import com.search.negatives.core.model.NegativeKeywordEntry;
import com.search.negatives.core.model.SearchTermRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One independent unit of batch work: a term dataset and the negative keywords to apply.
 *
 * <p>Rules are carried as raw entries and validated inside the unit, so an invalid
 * match type fails only this unit. The unit takes ownership of its records: they
 * are classified once the unit completes successfully, so the same record instances
 * must not be handed to another unit.</p>
 *
 * @param unitId identity used to correlate the outcome (e.g. a campaign name)
 * @param terms  search term records, classified when the unit succeeds
 * @param rules  negative keyword rows, in evaluation order
 */
public record BatchUnit(String unitId, List<SearchTermRecord> terms, List<NegativeKeywordEntry> rules) {

    public BatchUnit {
        Objects.requireNonNull(unitId, "unitId is required");
        if (unitId.isBlank()) {
            throw new IllegalArgumentException("unitId must not be blank");
        }
        terms = terms != null ? Collections.unmodifiableList(new ArrayList<>(terms)) : List.of();
        rules = rules != null ? List.copyOf(rules) : List.of();
    }

    public static BatchUnit of(String unitId, List<SearchTermRecord> terms, List<NegativeKeywordEntry> rules) {
        return new BatchUnit(unitId, terms, rules);
    }
}
