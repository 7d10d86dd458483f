package com.axlabs.neo.sharesgov.tally;

/**
 * The vote weight an option received.
 */
public class OptionResult {

    private final String option;
    private final long count;

    public OptionResult(String option, long count) {
        this.option = option;
        this.count = count;
    }

    public String getOption() {
        return option;
    }

    public long getCount() {
        return count;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OptionResult)) return false;
        OptionResult other = (OptionResult) o;
        return count == other.count && option.equals(other.option);
    }

    @Override
    public int hashCode() {
        return 31 * option.hashCode() + Long.hashCode(count);
    }

    @Override
    public String toString() {
        return option + "=" + count;
    }
}
