package com.viffx.Pda.Trace;

/**
 * One rendered line of a trace.
 */
public record TraceRecord(String stack, String remaining) {}
