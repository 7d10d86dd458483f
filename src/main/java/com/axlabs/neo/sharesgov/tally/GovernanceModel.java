package com.axlabs.neo.sharesgov.tally;

/**
 * Decision rules mapping the affirmative vote weight and the voting base to pass or fail. All thresholds use integer
 * arithmetic.
 */
public enum GovernanceModel {

    /**
     * Passes if the affirmative weight is strictly greater than {@code base / 2}. Ties fail.
     */
    SIMPLE_MAJORITY {
        @Override
        public long threshold(long base) {
            return base / 2 + 1;
        }
    },

    /**
     * Passes if the affirmative weight reaches {@code (base * 2) / 3}, rounded down.
     */
    SUPERMAJORITY {
        @Override
        public long threshold(long base) {
            // Equals (base * 2) / 3 without overflowing for large bases.
            return base / 3 * 2 + base % 3 * 2 / 3;
        }
    },

    /**
     * Passes only if the affirmative weight equals the base.
     */
    CONSENSUS {
        @Override
        public long threshold(long base) {
            return base;
        }

        @Override
        public boolean passes(long affirmative, long base) {
            return affirmative == base;
        }
    };

    /**
     * @param base The voting base.
     * @return the smallest affirmative weight that passes.
     */
    public abstract long threshold(long base);

    public boolean passes(long affirmative, long base) {
        return affirmative >= threshold(base);
    }
}
