package com.viffx.Pda.Errors;

/**
 * Thrown when the stack and the input did not run out together.
 */
public class IncompleteDerivationException extends PdaException {
    private final String stack;
    private final String remaining;

    public IncompleteDerivationException(String stack, String remaining) {
        super("Incomplete derivation: stack '" + stack + "' input '" + remaining + "'");
        this.stack = stack;
        this.remaining = remaining;
    }

    public String stack() {
        return stack;
    }

    public String remaining() {
        return remaining;
    }
}
