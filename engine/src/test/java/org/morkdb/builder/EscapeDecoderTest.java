package org.morkdb.builder;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Escape decoding")
class EscapeDecoderTest {

    @Test
    void plainTextIsUnchanged() {
        assertEquals("Hello World", EscapeDecoder.decode("Hello World"));
        assertEquals("", EscapeDecoder.decode(""));
    }

    @Test
    void dollarHexDecodesToByteValue() {
        assertEquals("hi!", EscapeDecoder.decode("$68$69$21"));
        assertEquals("a b", EscapeDecoder.decode("a$20b"));
        assertEquals("é", EscapeDecoder.decode("$e9"));
    }

    @Test
    void dollarWithoutTwoHexDigitsIsLiteral() {
        assertEquals("$", EscapeDecoder.decode("$"));
        assertEquals("$4", EscapeDecoder.decode("$4"));
        assertEquals("$zz", EscapeDecoder.decode("$zz"));
        assertEquals("cost $5.00", EscapeDecoder.decode("cost $5.00"));
    }

    @Test
    void backslashEscapesNextCharacter() {
        assertEquals(")", EscapeDecoder.decode("\\)"));
        assertEquals("\\", EscapeDecoder.decode("\\\\"));
        assertEquals("$41", EscapeDecoder.decode("\\$41"));
        assertEquals("q", EscapeDecoder.decode("\\q"));
    }

    @Test
    void lineContinuationsAreRemoved() {
        assertEquals("foobar", EscapeDecoder.decode("foo\\\nbar"));
        assertEquals("foobar", EscapeDecoder.decode("foo\\\r\nbar"));
    }

    @Test
    void backslashCarriageReturnWithoutNewlineKeepsCarriageReturn() {
        assertEquals("a\rb", EscapeDecoder.decode("a\\\rb"));
    }

    @Test
    void trailingBackslashIsKept() {
        assertEquals("end\\", EscapeDecoder.decode("end\\"));
    }

    @Test
    void decodingIsSinglePass() {
        // The escaped backslash must not start a new escape
        assertEquals("\\41", EscapeDecoder.decode("\\\\41"));
        // A decoded '$' must not be decoded again
        assertEquals("$41", EscapeDecoder.decode("$2441"));
    }
}
