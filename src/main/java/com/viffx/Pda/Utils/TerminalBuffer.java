package com.viffx.Pda.Utils;

import com.viffx.Pda.Symbols.Terminal;

import java.util.List;
import java.util.NoSuchElementException;

/**
 * Provides single-terminal lookahead over the already tokenized input of one parse.
 *
 * <p>The buffer only moves forward. Once a terminal has been consumed with
 * {@link #nextTerminal()} it can never be read again, which is what lets the
 * automaton report the untouched remainder of the input after every step.
 *
 * <p>EOF (end-of-input) is reached when every terminal, sentinel included, has been consumed.
 */
public final class TerminalBuffer {
    // ====== INSTANCE FIELDS ====== //

    /**
     * Terminals supplied by the lexer, ending with {@link Terminal#EOF}.
     */
    private final List<Terminal> terminals;

    /**
     * Index of the current terminal.
     */
    private int index = 0;

    // ====== CONSTRUCTORS ====== //
    /**
     * @param terminals the tokenized input, sentinel included
     */
    public TerminalBuffer(List<Terminal> terminals) {
        this.terminals = List.copyOf(terminals);
    }

    // ====== PUBLIC API METHODS ====== //
    /**
     * Returns {@code true} if every terminal has been consumed.
     */
    public boolean eof() {
        return index >= terminals.size();
    }

    /**
     * Returns the current terminal without consuming it.
     *
     * @throws NoSuchElementException if the input is exhausted
     */
    public Terminal crntTerminal() {
        if (eof()) throw new NoSuchElementException("Reached the end of the input.");
        return terminals.get(index);
    }

    /**
     * Consumes the current terminal.
     *
     * @return the terminal that was consumed
     * @throws NoSuchElementException if the input is exhausted
     */
    public Terminal nextTerminal() {
        Terminal current = crntTerminal();
        index++;
        return current;
    }

    /**
     * Returns the zero-based position of the current terminal in the input.
     */
    public int position() {
        return index;
    }

    // ====== DEBUG INFO ====== //
    /**
     * Returns the part of the input that has not been consumed yet, e.g. {@code "b*c$"}.
     */
    public String remaining() {
        StringBuilder builder = new StringBuilder();
        for (int i = index; i < terminals.size(); i++) {
            builder.append(terminals.get(i).character());
        }
        return builder.toString();
    }

    @Override
    public String toString() {
        return "TerminalBuffer{" +
                "remaining='" + remaining() +
                "', position=" + index +
                '}';
    }
}
