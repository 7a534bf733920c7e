package com.viffx.Pda.Trace;

import com.viffx.Pda.Symbols.Symbol;

import java.util.List;

/**
 * Watches an automaton run. Called once before the first step and once after every step.
 * Observers only see copies of the automaton's state and cannot influence the parse.
 */
@FunctionalInterface
public interface TraceObserver {
    TraceObserver NONE = (stack, remaining) -> {};

    /**
     * @param stack     the stack from bottom to top, unmodifiable
     * @param remaining the unconsumed input, sentinel included
     */
    void observe(List<Symbol> stack, String remaining);

    /**
     * Concatenates the text of each symbol, bottom of the stack first, e.g. {@code "$<D><E>"}.
     */
    static String render(List<? extends Symbol> stack) {
        StringBuilder builder = new StringBuilder();
        for (Symbol symbol : stack) {
            builder.append(symbol.value());
        }
        return builder.toString();
    }
}
