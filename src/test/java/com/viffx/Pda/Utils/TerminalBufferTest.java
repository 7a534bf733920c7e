package com.viffx.Pda.Utils;

import com.viffx.Pda.Symbols.Terminal;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;

class TerminalBufferTest {

    @Test void consumesLeftToRight() {
        TerminalBuffer buffer = new TerminalBuffer(List.of(Terminal.A, Terminal.ASTERISK, Terminal.B, Terminal.EOF));
        assertEquals("a*b$", buffer.remaining());
        assertEquals(Terminal.A, buffer.crntTerminal());
        assertEquals(Terminal.A, buffer.nextTerminal());
        assertEquals(1, buffer.position());
        assertEquals("*b$", buffer.remaining());
        buffer.nextTerminal();
        buffer.nextTerminal();
        assertEquals(Terminal.EOF, buffer.nextTerminal());
        assertTrue(buffer.eof());
        assertEquals("", buffer.remaining());
    }

    @Test void cannotReadPastTheEnd() {
        TerminalBuffer buffer = new TerminalBuffer(List.of(Terminal.EOF));
        buffer.nextTerminal();
        assertThrows(NoSuchElementException.class, buffer::crntTerminal);
        assertThrows(NoSuchElementException.class, buffer::nextTerminal);
    }
}
