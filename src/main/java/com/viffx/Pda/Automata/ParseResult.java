package com.viffx.Pda.Automata;

import com.viffx.Pda.Errors.PdaException;

import java.util.Objects;

/**
 * Outcome of one run of a {@link StackAutomaton}.
 */
public sealed interface ParseResult permits ParseResult.Accepted, ParseResult.Rejected {
    ParseResult ACCEPTED = new Accepted();

    boolean accepted();

    /**
     * Stack and input were exhausted in the same step.
     */
    record Accepted() implements ParseResult {
        @Override
        public boolean accepted() {
            return true;
        }
    }

    /**
     * @param reason the error that stopped the parse
     */
    record Rejected(PdaException reason) implements ParseResult {
        public Rejected {
            Objects.requireNonNull(reason, "reason cannot be null");
        }

        @Override
        public boolean accepted() {
            return false;
        }
    }
}
