package com.viffx.Pda.Grammar;

import com.viffx.Pda.Errors.NoProductionException;
import com.viffx.Pda.Symbols.NonTerminal;
import com.viffx.Pda.Symbols.Symbol;
import com.viffx.Pda.Symbols.Terminal;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.util.*;
import java.util.stream.Collectors;

import static com.viffx.Pda.Symbols.Epsilon.EPSILON;

/**
 * LL(1) parsing/jump table. Maps the nonterminal on top of the stack and the current input terminal
 * to the production that replaces it.
 * <p>
 * The table is partial on purpose: a missing cell means the input is not in the language, and
 * {@link #lookup(NonTerminal, Terminal)} reports it as a {@link NoProductionException}.
 * Instances are immutable and may be shared between any number of automata.
 */
public final class TransitionTable {
    // ====== INSTANCE FIELDS ====== //
    private final Map<TransitionKey, List<Symbol>> productions;

    // ====== STATIC FIELDS ====== //
    /**
     * The table for
     * <pre>
     * A -> B D
     * D -> - B D | ε
     * B -> C E
     * E -> * C E | ε
     * C -> a | b | c | ( A )
     * </pre>
     */
    public static final TransitionTable EXPRESSIONS = expressions();

    // ====== CONSTRUCTORS ====== //
    private TransitionTable(Map<TransitionKey, List<Symbol>> productions) {
        this.productions = Collections.unmodifiableMap(new LinkedHashMap<>(productions));
    }

    @NotNull
    @Contract(" -> new")
    public static Builder builder() {
        return new Builder();
    }

    private static TransitionTable expressions() {
        NonTerminal A = NonTerminal.A, B = NonTerminal.B, C = NonTerminal.C, D = NonTerminal.D, E = NonTerminal.E;
        Builder builder = builder();

        // expression and term descend on anything that can start a factor
        for (Terminal t : List.of(Terminal.A, Terminal.B, Terminal.C, Terminal.LEFT_BRACKET)) {
            builder.put(A, t, B, D);
            builder.put(B, t, C, E);
        }

        // factor
        builder.put(C, Terminal.A, Terminal.A);
        builder.put(C, Terminal.B, Terminal.B);
        builder.put(C, Terminal.C, Terminal.C);
        builder.put(C, Terminal.LEFT_BRACKET, Terminal.LEFT_BRACKET, A, Terminal.RIGHT_BRACKET);

        // tails
        builder.put(D, Terminal.MINUS, Terminal.MINUS, B, D);
        builder.put(D, Terminal.RIGHT_BRACKET, EPSILON);
        builder.put(D, Terminal.EOF, EPSILON);
        builder.put(E, Terminal.ASTERISK, Terminal.ASTERISK, C, E);
        builder.put(E, Terminal.MINUS, EPSILON);
        builder.put(E, Terminal.RIGHT_BRACKET, EPSILON);
        builder.put(E, Terminal.EOF, EPSILON);

        return builder.build();
    }

    // ====== PUBLIC API ====== //
    /**
     * Returns the production selected by {@code state} under {@code lookahead}.
     *
     * @param state     the nonterminal popped from the stack
     * @param lookahead the current input terminal
     * @return the right hand side, leftmost symbol first
     * @throws NoProductionException if the table has no cell for the pair
     */
    public List<Symbol> lookup(NonTerminal state, Terminal lookahead) throws NoProductionException {
        List<Symbol> production = productions.get(new TransitionKey(state, lookahead));
        if (production == null) throw new NoProductionException(state, lookahead);
        return production;
    }

    public boolean contains(NonTerminal state, Terminal lookahead) {
        return productions.containsKey(new TransitionKey(state, lookahead));
    }

    /**
     * Returns every cell of the table in the order it was defined.
     */
    public Map<TransitionKey, List<Symbol>> entries() {
        return productions;
    }

    public int size() {
        return productions.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TransitionTable that = (TransitionTable) o;
        return productions.equals(that.productions);
    }

    @Override
    public int hashCode() {
        return productions.hashCode();
    }

    @Override
    public String toString() {
        return productions.entrySet()
                .stream()
                .map(entry -> entry.getKey() + " -> " + entry.getValue()
                        .stream()
                        .map(symbol -> symbol == EPSILON ? symbol.toString() : symbol.value())
                        .collect(Collectors.joining()))
                .collect(Collectors.joining("\n"));
    }

    // ====== BUILDER ====== //
    public static final class Builder {
        private final Map<TransitionKey, List<Symbol>> productions = new LinkedHashMap<>();

        private Builder() {}

        /**
         * Adds one cell to the table.
         *
         * @throws IllegalStateException if the cell is already defined, which would make the grammar ambiguous under one lookahead
         * @throws IllegalArgumentException if {@code rhs} is empty; use {@code EPSILON} for the empty production
         */
        public Builder put(NonTerminal state, Terminal lookahead, Symbol... rhs) {
            TransitionKey key = new TransitionKey(state, lookahead);
            if (rhs.length == 0) throw new IllegalArgumentException("The production for " + key + " needs at least one symbol");
            for (Symbol symbol : rhs) Objects.requireNonNull(symbol, "symbols cannot be null");
            if (productions.containsKey(key)) {
                throw new IllegalStateException("Conflict at " + key + ": " + productions.get(key) + " is already defined");
            }
            productions.put(key, List.of(rhs));
            return this;
        }

        public TransitionTable build() {
            return new TransitionTable(productions);
        }
    }
}
