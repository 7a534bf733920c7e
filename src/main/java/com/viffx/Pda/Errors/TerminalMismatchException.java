package com.viffx.Pda.Errors;

import com.viffx.Pda.Symbols.Terminal;

public class TerminalMismatchException extends PdaException {
    private final Terminal expected;
    private final Terminal found;
    private final int position;

    public TerminalMismatchException(Terminal expected, Terminal found, int position) {
        super("Should be " + expected.value() + " got " + found.value());
        this.expected = expected;
        this.found = found;
        this.position = position;
    }

    public Terminal expected() {
        return expected;
    }

    public Terminal found() {
        return found;
    }

    /**
     * Zero-based index of {@link #found()} in the input, the sentinel counting as the last position.
     */
    public int position() {
        return position;
    }
}
