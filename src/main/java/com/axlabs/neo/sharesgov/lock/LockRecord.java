package com.axlabs.neo.sharesgov.lock;

import io.neow3j.types.Hash160;

/**
 * Shares of one class a holder has in escrow, and when they can be released.
 */
public class LockRecord {

    private final Hash160 holder;
    private final int shareClass;
    private final long amount;
    private final long unlockTime;

    public LockRecord(Hash160 holder, int shareClass, long amount, long unlockTime) {
        this.holder = holder;
        this.shareClass = shareClass;
        this.amount = amount;
        this.unlockTime = unlockTime;
    }

    public Hash160 getHolder() {
        return holder;
    }

    public int getShareClass() {
        return shareClass;
    }

    public long getAmount() {
        return amount;
    }

    /**
     * @return the earliest time at which the amount may be unlocked.
     */
    public long getUnlockTime() {
        return unlockTime;
    }
}
