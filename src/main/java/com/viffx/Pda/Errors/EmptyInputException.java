package com.viffx.Pda.Errors;

public class EmptyInputException extends PdaException {
    public EmptyInputException() {
        super("No input supplied");
    }
}
