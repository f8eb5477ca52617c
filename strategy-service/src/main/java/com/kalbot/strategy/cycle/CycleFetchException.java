package com.kalbot.strategy.cycle;

/**
 * A collaborator failed while the cycle was collecting its inputs; nothing was evaluated.
 */
public class CycleFetchException extends RuntimeException {

    public CycleFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
