package com.planverify.core.repository;

/**
 * Summed vote counters over a set of reports.
 */
public record VoteTotals(long upvotes, long downvotes) {

    public static final VoteTotals NONE = new VoteTotals(0, 0);

    // Target of the JPQL constructor expression; SUM may come back as Long or Integer.
    public VoteTotals(Number upvotes, Number downvotes) {
        this(upvotes == null ? 0 : upvotes.longValue(), downvotes == null ? 0 : downvotes.longValue());
    }
}
