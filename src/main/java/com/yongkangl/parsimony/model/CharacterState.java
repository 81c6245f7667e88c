package com.yongkangl.parsimony.model;

/**
 * Candidate state set of a binary (absent/present) character at a node.
 * Each constant is a bit mask over the two values: bit 0 for absent, bit 1 for present.
 */
public enum CharacterState {
    ZERO(0b01),
    ONE(0b10),
    BOTH(0b11);

    private final int mask;

    CharacterState(int mask) {
        this.mask = mask;
    }

    public static CharacterState of(int value) {
        switch (value) {
            case 0:
                return ZERO;
            case 1:
                return ONE;
            default:
                throw new IllegalArgumentException("Binary state must be 0 or 1, got " + value);
        }
    }

    private static CharacterState fromMask(int mask) {
        for (CharacterState state : values()) {
            if (state.mask == mask) {
                return state;
            }
        }
        return null;
    }

    /**
     * @return the intersection, or {@code null} when the two sets are disjoint
     */
    public CharacterState intersect(CharacterState other) {
        return fromMask(mask & other.mask);
    }

    public CharacterState union(CharacterState other) {
        return fromMask(mask | other.mask);
    }

    public boolean isSubsetOf(CharacterState other) {
        return (mask & other.mask) == mask;
    }

    public boolean isAmbiguous() {
        return this == BOTH;
    }

    public boolean contains(int value) {
        return (mask & of(value).mask) != 0;
    }

    /**
     * @return 0 or 1 for a resolved state
     * @throws IllegalStateException when both values are still possible
     */
    public int value() {
        if (this == BOTH) {
            throw new IllegalStateException("State {0,1} has no single value");
        }
        return this == ONE ? 1 : 0;
    }

    @Override
    public String toString() {
        switch (this) {
            case ZERO:
                return "{0}";
            case ONE:
                return "{1}";
            default:
                return "{0,1}";
        }
    }
}
