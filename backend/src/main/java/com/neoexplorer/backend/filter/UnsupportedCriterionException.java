package com.neoexplorer.backend.filter;

/**
 * A filter was requested for a criterion that cannot evaluate the given reference value.
 */
public class UnsupportedCriterionException extends UnsupportedOperationException {

    public UnsupportedCriterionException(String message) {
        super(message);
    }
}
