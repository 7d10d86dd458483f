package com.axlabs.neo.sharesgov.fraction;

import io.neow3j.types.Hash160;

/**
 * The ownership record of a fractionalised asset. Votes on a fraction are ordinary proposals linked to it by the
 * fraction id.
 */
public class Fraction {

    private final int id;
    private final String assetId;
    private final Hash160 owner;
    private final long amount;
    private final long createdAt;

    public Fraction(int id, String assetId, Hash160 owner, long amount, long createdAt) {
        this.id = id;
        this.assetId = assetId;
        this.owner = owner;
        this.amount = amount;
        this.createdAt = createdAt;
    }

    public int getId() {
        return id;
    }

    /**
     * @return the share class of the fraction, which is its id.
     */
    public int getShareClass() {
        return id;
    }

    /**
     * @return the id of the asset that was fractionalised.
     */
    public String getAssetId() {
        return assetId;
    }

    /**
     * @return the nominal owner, who received the minted shares.
     */
    public Hash160 getOwner() {
        return owner;
    }

    /**
     * @return the amount of shares minted at creation.
     */
    public long getAmount() {
        return amount;
    }

    public long getCreatedAt() {
        return createdAt;
    }
}
