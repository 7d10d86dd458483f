package com.axlabs.neo.sharesgov.lock;

import org.junit.jupiter.api.Test;

import static com.axlabs.neo.sharesgov.util.TestHelper.voter;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class LockedBalancesTest {

    private final LockedBalances locks = new LockedBalances();

    @Test
    public void merge_locks_and_keep_later_unlock_time() {
        locks.add(voter(1), 3, 10, 500);
        LockRecord r = locks.add(voter(1), 3, 5, 400);
        assertThat(r.getAmount(), is(15L));
        assertThat(r.getUnlockTime(), is(500L));

        r = locks.add(voter(1), 3, 1, 900);
        assertThat(r.getUnlockTime(), is(900L));
        assertThat(locks.lockedOf(voter(1), 3), is(16L));
        assertThat(locks.lockedOf(voter(1), 4), is(0L));
        assertThat(locks.lockedOf(voter(2), 3), is(0L));
    }

    @Test
    public void clear_record_when_fully_released() {
        locks.add(voter(1), 3, 10, 500);
        LockRecord r = locks.release(voter(1), 3, 4);
        assertThat(r.getAmount(), is(6L));
        assertThat(r.getUnlockTime(), is(500L));
        assertThat(locks.release(voter(1), 3, 6), is(nullValue()));
        assertThat(locks.get(voter(1), 3), is(nullValue()));
    }

    @Test
    public void fail_releasing_more_than_locked() {
        locks.add(voter(1), 3, 10, 500);
        assertThrows(IllegalStateException.class, () -> locks.release(voter(1), 3, 11));
        assertThrows(IllegalStateException.class, () -> locks.release(voter(2), 3, 1));
        assertThat(locks.lockedOf(voter(1), 3), is(10L));
    }
}
