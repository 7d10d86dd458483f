package com.axlabs.neo.sharesgov.ledger;

import io.neow3j.types.Hash160;

/**
 * Decides whether a caller may perform operator actions, e.g., creating proposals, opening voting or finalizing.
 */
@FunctionalInterface
public interface AccessControl {

    boolean isAuthorized(Hash160 caller);
}
