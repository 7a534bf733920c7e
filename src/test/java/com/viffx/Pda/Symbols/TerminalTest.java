package com.viffx.Pda.Symbols;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TerminalTest {

    @Test void classifiesEveryInputCharacter() {
        assertEquals(Terminal.A, Terminal.fromChar('a'));
        assertEquals(Terminal.B, Terminal.fromChar('b'));
        assertEquals(Terminal.C, Terminal.fromChar('c'));
        assertEquals(Terminal.MINUS, Terminal.fromChar('-'));
        assertEquals(Terminal.ASTERISK, Terminal.fromChar('*'));
        assertEquals(Terminal.LEFT_BRACKET, Terminal.fromChar('('));
        assertEquals(Terminal.RIGHT_BRACKET, Terminal.fromChar(')'));
    }

    @Test void sentinelIsNotAnInputCharacter() {
        assertNull(Terminal.fromChar('$'));
        assertEquals("$", Terminal.EOF.value());
    }

    @Test void foreignCharactersAreNotTerminals() {
        for (char c : "+dA /\t0".toCharArray()) {
            assertNull(Terminal.fromChar(c), "'" + c + "'");
        }
    }

    @Test void valueRoundTripsThroughFromChar() {
        for (Terminal t : Terminal.values()) {
            if (t == Terminal.EOF) continue;
            assertSame(t, Terminal.fromChar(t.character()));
        }
    }

    @Test void nonTerminalsRenderInAngleBrackets() {
        assertEquals("<A>", NonTerminal.A.value());
        assertEquals("<E>", NonTerminal.E.toString());
        assertSame(NonTerminal.A, NonTerminal.START);
    }

    @Test void epsilonRendersAsNothing() {
        assertEquals("", Epsilon.EPSILON.value());
        assertEquals("ε", Epsilon.EPSILON.toString());
    }
}
