package com.dnagraph.core.scratchpad;

/**
 * A scratchpad request that cannot be carried out as given.
 */
public class ScratchpadException extends RuntimeException {

    public ScratchpadException(String message) {
        super(message);
    }
}
