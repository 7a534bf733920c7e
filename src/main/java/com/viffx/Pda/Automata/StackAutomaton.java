package com.viffx.Pda.Automata;

import com.viffx.Pda.Errors.IncompleteDerivationException;
import com.viffx.Pda.Errors.PdaException;
import com.viffx.Pda.Errors.TerminalMismatchException;
import com.viffx.Pda.Grammar.TransitionTable;
import com.viffx.Pda.Lexer;
import com.viffx.Pda.Symbols.Epsilon;
import com.viffx.Pda.Symbols.NonTerminal;
import com.viffx.Pda.Symbols.Symbol;
import com.viffx.Pda.Symbols.Terminal;
import com.viffx.Pda.Trace.TraceObserver;
import com.viffx.Pda.Utils.TerminalBuffer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;
import java.util.Stack;

/**
 * Pushdown automaton that decides membership of a string by simulating a leftmost derivation on an
 * explicit stack, choosing every production from a {@link TransitionTable} with one terminal of lookahead.
 * <p>
 * The stack starts as {@code [$, start]}. Each step pops one symbol:
 * <ul>
 *   <li>a {@link NonTerminal} is replaced by its production, pushed in reverse so the leftmost symbol is on top,</li>
 *   <li>a {@link Terminal} must equal the current input terminal, which is then consumed,</li>
 *   <li>{@link Epsilon#EPSILON} is dropped.</li>
 * </ul>
 * The string is accepted only if the stack and the input run out in the same step.
 * Nothing is ever undone: the first error ends the parse.
 * <p>
 * Stack and input live only for the duration of one call, so an instance can be reused for any number of parses.
 */
public class StackAutomaton {
    private static final Logger log = LogManager.getLogger(StackAutomaton.class);

    private final TransitionTable table;
    private final NonTerminal start;
    private final TraceObserver observer;

    public StackAutomaton(TransitionTable table, NonTerminal start, TraceObserver observer) {
        this.table = Objects.requireNonNull(table, "table cannot be null");
        this.start = Objects.requireNonNull(start, "start cannot be null");
        this.observer = Objects.requireNonNull(observer, "observer cannot be null");
    }

    public StackAutomaton(TraceObserver observer) {
        this(TransitionTable.EXPRESSIONS, NonTerminal.START, observer);
    }

    public StackAutomaton() {
        this(TraceObserver.NONE);
    }

    /**
     * Runs the automaton and folds any failure into the result.
     *
     * @param input the raw line, without the sentinel
     */
    public ParseResult parse(String input) {
        try {
            analyze(input);
            return ParseResult.ACCEPTED;
        } catch (PdaException e) {
            log.info("Rejected '{}': {}", input, e.getMessage());
            return new ParseResult.Rejected(e);
        }
    }

    /**
     * Runs the automaton on {@code input}.
     *
     * @param input the raw line, without the sentinel
     * @throws PdaException describing the first step that could not be taken
     */
    public void analyze(String input) throws PdaException {
        TerminalBuffer buffer = new TerminalBuffer(Lexer.tokenize(input));
        Stack<Symbol> stack = new Stack<>();
        stack.push(Terminal.EOF);
        stack.push(start);
        observe(stack, buffer);

        while (!buffer.eof() && !stack.isEmpty()) {
            Symbol popped = stack.pop();
            if (popped instanceof NonTerminal state) {
                Terminal lookahead = buffer.crntTerminal();
                List<Symbol> production = table.lookup(state, lookahead);
                log.debug("Expanding {} on {} to {}", state, lookahead, production);
                for (int i = production.size() - 1; i >= 0; i--) {
                    stack.push(production.get(i));
                }
            } else if (popped instanceof Terminal terminal) {
                Terminal current = buffer.crntTerminal();
                if (current != terminal) {
                    throw new TerminalMismatchException(terminal, current, buffer.position());
                }
                buffer.nextTerminal();
                log.debug("Matched {}", terminal);
            } else {
                // EPSILON: nothing to expand and nothing to consume
                assert popped == Epsilon.EPSILON;
            }
            observe(stack, buffer);
        }

        if (!stack.isEmpty() || !buffer.eof()) {
            throw new IncompleteDerivationException(TraceObserver.render(stack), buffer.remaining());
        }
        log.info("Accepted '{}'", input);
    }

    public TransitionTable table() {
        return table;
    }

    public NonTerminal start() {
        return start;
    }

    private void observe(Stack<Symbol> stack, TerminalBuffer buffer) {
        observer.observe(List.copyOf(stack), buffer.remaining());
    }
}
