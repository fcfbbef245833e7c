package com.kinshipkeeper.service;

import com.kinshipkeeper.model.Rejection;

/**
 * A request the core refuses. Terminal for the call: nothing is retried and nothing was written.
 */
public class RejectionException extends RuntimeException {

    private final Rejection rejection;

    public RejectionException(Rejection rejection, String message) {
        super(message);
        this.rejection = rejection;
    }

    public Rejection getRejection() {
        return rejection;
    }
}
