package com.viffx.Pda.Errors;

/**
 * Base type for every way a parse can fail. The first one thrown ends the parse.
 */
public abstract class PdaException extends Exception {
    protected PdaException(String message) {
        super(message);
    }
}
