package com.yongkangl.parsimony.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of one parsimony reconstruction: the minimum number of changes and every accepted history.
 */
public final class Reconstruction {
    /**
     * Why the history list has the contents it has. Every value other than {@code RESOLVED} comes with an empty list.
     */
    public enum Outcome {
        RESOLVED,
        TOO_AMBIGUOUS,
        ORIGIN_VETOED,
        NO_OPTIMAL_ASSIGNMENT
    }

    private final String trait;
    private final int minChanges;
    private final int ambiguousNodeCount;
    private final Outcome outcome;
    private final List<AnnotatedTree> histories;

    public Reconstruction(String trait, int minChanges, int ambiguousNodeCount, Outcome outcome, List<AnnotatedTree> histories) {
        this.trait = trait;
        this.minChanges = minChanges;
        this.ambiguousNodeCount = ambiguousNodeCount;
        this.outcome = outcome;
        this.histories = Collections.unmodifiableList(new ArrayList<>(histories));
    }

    public String getTrait() {
        return trait;
    }

    public int getMinChanges() {
        return minChanges;
    }

    public int getAmbiguousNodeCount() {
        return ambiguousNodeCount;
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public List<AnnotatedTree> getHistories() {
        return histories;
    }

    @Override
    public String toString() {
        return (trait == null ? "" : trait + ": ") + "minChanges=" + minChanges + ", ambiguous=" + ambiguousNodeCount
                + ", " + outcome + ", histories=" + histories.size();
    }
}
