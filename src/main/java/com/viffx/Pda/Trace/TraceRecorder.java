package com.viffx.Pda.Trace;

import com.viffx.Pda.Symbols.Symbol;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Keeps every observation in order.
 */
public final class TraceRecorder implements TraceObserver {
    private final List<TraceRecord> records = new ArrayList<>();

    @Override
    public void observe(List<Symbol> stack, String remaining) {
        records.add(new TraceRecord(TraceObserver.render(stack), remaining));
    }

    public List<TraceRecord> records() {
        return Collections.unmodifiableList(records);
    }

    public TraceRecord last() {
        return records.get(records.size() - 1);
    }

    public void clear() {
        records.clear();
    }
}
