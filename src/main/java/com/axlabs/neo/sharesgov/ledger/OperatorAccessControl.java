package com.axlabs.neo.sharesgov.ledger;

import io.neow3j.types.Hash160;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Grants operator rights to a fixed set of accounts given at construction.
 */
public class OperatorAccessControl implements AccessControl {

    private final Set<Hash160> operators;

    public OperatorAccessControl(Collection<Hash160> operators) {
        if (operators == null || operators.isEmpty()) {
            throw new IllegalArgumentException("At least one operator is required");
        }
        this.operators = Collections.unmodifiableSet(new LinkedHashSet<>(operators));
    }

    @Override
    public boolean isAuthorized(Hash160 caller) {
        return caller != null && operators.contains(caller);
    }

    /**
     * @return the operators in the order they were given.
     */
    public Set<Hash160> getOperators() {
        return operators;
    }
}
