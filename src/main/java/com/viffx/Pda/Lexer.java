package com.viffx.Pda;

import com.viffx.Pda.Errors.EmptyInputException;
import com.viffx.Pda.Errors.UnknownInputSymbolException;
import com.viffx.Pda.Symbols.Terminal;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a line of user input into terminals. Every character is classified exactly once here,
 * so the automaton never has to deal with characters outside the alphabet.
 */
public final class Lexer {
    private Lexer() {}

    /**
     * Tokenizes {@code input} and appends the {@link Terminal#EOF} sentinel.
     *
     * @throws EmptyInputException if {@code input} is {@code null}
     * @throws UnknownInputSymbolException at the first character outside the input alphabet, including a literal {@code $}
     */
    public static List<Terminal> tokenize(String input) throws EmptyInputException, UnknownInputSymbolException {
        if (input == null) throw new EmptyInputException();

        List<Terminal> terminals = new ArrayList<>(input.length() + 1);
        for (int i = 0; i < input.length(); i++) {
            char c = input.charAt(i);
            Terminal terminal = Terminal.fromChar(c);
            if (terminal == null) throw new UnknownInputSymbolException(c, i);
            terminals.add(terminal);
        }
        terminals.add(Terminal.EOF);
        return terminals;
    }
}
