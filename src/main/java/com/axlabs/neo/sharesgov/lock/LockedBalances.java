package com.axlabs.neo.sharesgov.lock;

import io.neow3j.types.Hash160;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The escrow sub-ledger. Holds one {@link LockRecord} per holder and share class. Records are replaced, never
 * mutated, and removed once nothing is locked anymore.
 */
public class LockedBalances {

    private final Map<Key, LockRecord> locks = new HashMap<>();

    /**
     * @return the lock of the holder or null if nothing is locked.
     */
    public LockRecord get(Hash160 holder, int shareClass) {
        return locks.get(new Key(holder, shareClass));
    }

    public long lockedOf(Hash160 holder, int shareClass) {
        LockRecord r = get(holder, shareClass);
        return r == null ? 0 : r.getAmount();
    }

    /**
     * Adds {@code amount} to the holder's lock. The unlock time of the record becomes the later of the existing and
     * the given one.
     *
     * @return the updated record.
     */
    public LockRecord add(Hash160 holder, int shareClass, long amount, long unlockTime) {
        Key key = new Key(holder, shareClass);
        LockRecord existing = locks.get(key);
        LockRecord updated;
        if (existing == null) {
            updated = new LockRecord(holder, shareClass, amount, unlockTime);
        } else {
            updated = new LockRecord(holder, shareClass, Math.addExact(existing.getAmount(), amount),
                    Math.max(existing.getUnlockTime(), unlockTime));
        }
        locks.put(key, updated);
        return updated;
    }

    /**
     * Removes {@code amount} from the holder's lock. The caller checks that enough is locked.
     *
     * @return the remaining record or null if it was cleared.
     */
    public LockRecord release(Hash160 holder, int shareClass, long amount) {
        Key key = new Key(holder, shareClass);
        LockRecord existing = locks.get(key);
        if (existing == null || existing.getAmount() < amount) {
            throw new IllegalStateException("Releasing more than is locked");
        }
        long remaining = existing.getAmount() - amount;
        if (remaining == 0) {
            locks.remove(key);
            return null;
        }
        LockRecord updated = new LockRecord(holder, shareClass, remaining, existing.getUnlockTime());
        locks.put(key, updated);
        return updated;
    }

    private static final class Key {
        private final Hash160 holder;
        private final int shareClass;

        private Key(Hash160 holder, int shareClass) {
            this.holder = holder;
            this.shareClass = shareClass;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Key)) return false;
            Key other = (Key) o;
            return shareClass == other.shareClass && holder.equals(other.holder);
        }

        @Override
        public int hashCode() {
            return Objects.hash(holder, shareClass);
        }
    }
}
