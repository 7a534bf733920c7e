package com.viffx.Pda.Symbols;

import org.jetbrains.annotations.Nullable;

public enum Terminal implements Symbol {
    A('a'),
    B('b'),
    C('c'),
    MINUS('-'),
    ASTERISK('*'),
    LEFT_BRACKET('('),
    RIGHT_BRACKET(')'),
    EOF('$'); // End Of File, never read from user input

    private final char character;

    Terminal(char character) {
        this.character = character;
    }

    public char character() {
        return character;
    }

    @Override
    public String value() {
        return String.valueOf(character);
    }

    /**
     * Classifies a single input character.
     *
     * @param c the character read from the user
     * @return the matching terminal, or {@code null} if {@code c} is outside the input alphabet
     */
    public static @Nullable Terminal fromChar(char c) {
        return switch (c) {
            case 'a' -> A;
            case 'b' -> B;
            case 'c' -> C;
            case '-' -> MINUS;
            case '*' -> ASTERISK;
            case '(' -> LEFT_BRACKET;
            case ')' -> RIGHT_BRACKET;
            default -> null;
        };
    }

    @Override
    public String toString() {
        return value();
    }
}
