package com.axlabs.neo.sharesgov.ledger;

import io.neow3j.types.Hash160;

/**
 * The multi-asset share ledger the governance engine works against. The engine never owns balances. It reads them to
 * derive voting weight and moves spendable balance in and out of escrow through {@link #lock} and {@link #unlock}.
 * <p>
 * Share classes are identified by integers. For fractionalised assets the class id equals the fraction id.
 */
public interface ShareLedger {

    /**
     * @param holder     The holder's script hash.
     * @param shareClass The share class.
     * @return the spendable (not locked) balance of the holder.
     */
    long balanceOf(Hash160 holder, int shareClass);

    /**
     * @param shareClass The share class.
     * @return the total amount ever minted of the class, minus burned amounts.
     */
    long totalMinted(int shareClass);

    /**
     * Mints new shares of a class to a holder.
     *
     * @param holder     The receiver.
     * @param shareClass The share class.
     * @param amount     The amount to mint. Always positive.
     */
    void mint(Hash160 holder, int shareClass, long amount);

    /**
     * Removes {@code amount} from the holder's spendable balance and keeps it in escrow.
     *
     * @param holder     The holder.
     * @param shareClass The share class.
     * @param amount     The amount to lock. Never above the spendable balance.
     */
    void lock(Hash160 holder, int shareClass, long amount);

    /**
     * Moves {@code amount} from escrow back to the holder's spendable balance.
     *
     * @param holder     The holder.
     * @param shareClass The share class.
     * @param amount     The amount to release.
     */
    void unlock(Hash160 holder, int shareClass, long amount);
}
