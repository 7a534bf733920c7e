package com.viffx.Pda;

import com.viffx.Pda.Automata.ParseResult;
import com.viffx.Pda.Automata.StackAutomaton;
import com.viffx.Pda.Errors.EmptyInputException;
import com.viffx.Pda.Grammar.TransitionTable;
import com.viffx.Pda.Trace.ConsoleTrace;
import com.viffx.Pda.Trace.TraceObserver;
import com.viffx.Pda.Utils.PdaSettings;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

public class Main {
    public static final int ACCEPTED = 0;
    public static final int REJECTED = 1;
    public static final int USAGE = 2;

    public static void main(String[] args) throws IOException {
        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        System.exit(run(args, in, System.out, PdaSettings.load()));
    }

    /**
     * Reads one line from {@code in}, parses it and prints the trace followed by either
     * {@code ACCEPTED} or {@code ERROR: <message>}.
     *
     * @return the process exit code
     */
    public static int run(String[] args, BufferedReader in, PrintStream out, PdaSettings settings) throws IOException {
        boolean printTable = false;
        for (String arg : args) {
            switch (arg) {
                case "--quiet" -> settings = settings.withTraceEnabled(false);
                case "--table" -> printTable = true;
                default -> {
                    out.println("ERROR: Unknown option: " + arg);
                    return USAGE;
                }
            }
        }

        if (printTable) {
            out.println(TransitionTable.EXPRESSIONS);
            out.println();
        }

        String line = in.readLine();
        if (line == null) {
            out.println("ERROR: " + new EmptyInputException().getMessage());
            return REJECTED;
        }

        TraceObserver observer = settings.traceEnabled() ? new ConsoleTrace(out, settings.traceWidth()) : TraceObserver.NONE;
        ParseResult result = new StackAutomaton(observer).parse(line);
        if (result instanceof ParseResult.Rejected rejected) {
            out.println("ERROR: " + rejected.reason().getMessage());
            return REJECTED;
        }
        out.println("ACCEPTED");
        return ACCEPTED;
    }
}
