package com.viffx.Pda.Trace;

import com.viffx.Pda.Symbols.Symbol;

import java.io.PrintStream;
import java.util.List;

/**
 * Prints each observation as {@code <stack padded to width> \t <remaining input>}.
 */
public final class ConsoleTrace implements TraceObserver {
    private final PrintStream out;
    private final int width;

    public ConsoleTrace(PrintStream out, int width) {
        if (width <= 0) throw new IllegalArgumentException("width must be positive, got " + width);
        this.out = out;
        this.width = width;
    }

    @Override
    public void observe(List<Symbol> stack, String remaining) {
        out.println(format(TraceObserver.render(stack), remaining));
    }

    public String format(String stack, String remaining) {
        return String.format("%-" + width + "s \t %s", stack, remaining);
    }
}
