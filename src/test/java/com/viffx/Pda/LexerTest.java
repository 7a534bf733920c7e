package com.viffx.Pda;

import com.viffx.Pda.Errors.EmptyInputException;
import com.viffx.Pda.Errors.PdaException;
import com.viffx.Pda.Errors.UnknownInputSymbolException;
import com.viffx.Pda.Symbols.Terminal;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LexerTest {

    @Test void appendsSentinel() throws PdaException {
        assertEquals(List.of(Terminal.A, Terminal.MINUS, Terminal.B, Terminal.EOF), Lexer.tokenize("a-b"));
    }

    @Test void emptyLineIsJustTheSentinel() throws PdaException {
        assertEquals(List.of(Terminal.EOF), Lexer.tokenize(""));
    }

    @Test void nullIsNoInput() {
        assertThrows(EmptyInputException.class, () -> Lexer.tokenize(null));
    }

    @Test void reportsFirstUnknownCharacterAndPosition() {
        UnknownInputSymbolException e = assertThrows(UnknownInputSymbolException.class, () -> Lexer.tokenize("a*b+c/d"));
        assertEquals('+', e.symbol());
        assertEquals(3, e.position());
        assertEquals("Unknown input symbol '+' at position 3", e.getMessage());
    }

    @Test void literalSentinelIsRejected() {
        UnknownInputSymbolException e = assertThrows(UnknownInputSymbolException.class, () -> Lexer.tokenize("a$"));
        assertEquals('$', e.symbol());
        assertEquals(1, e.position());
    }

    @Test void whitespaceIsNotSkipped() {
        assertThrows(UnknownInputSymbolException.class, () -> Lexer.tokenize("a - b"));
    }
}
