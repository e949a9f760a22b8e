package com.codestyle.workspace;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class TextEncodingTest {

    @Test
    void charsetOptionsMapToEncodings() {
        assertEquals(TextEncoding.LATIN_1, TextEncoding.fromCharsetOption("latin1"));
        assertEquals(TextEncoding.UTF_8_BOM, TextEncoding.fromCharsetOption("utf-8-bom"));
        assertEquals(TextEncoding.UTF_16BE, TextEncoding.fromCharsetOption("utf-16be"));
        assertEquals(TextEncoding.UTF_16LE, TextEncoding.fromCharsetOption("utf-16le"));
        assertEquals(TextEncoding.UTF_8, TextEncoding.fromCharsetOption("utf-8"));
        assertEquals(TextEncoding.UTF_8, TextEncoding.fromCharsetOption("something-else"));
    }

    @Test
    void byteOrderMarkIsWrittenAndDetected() {
        byte[] bytes = TextEncoding.UTF_8_BOM.encode("hi");

        assertArrayEquals(new byte[]{(byte) 0xEF, (byte) 0xBB, (byte) 0xBF, 'h', 'i'}, bytes);

        TextEncoding.DecodedText decoded = TextEncoding.decode(bytes, TextEncoding.UTF_8);
        assertEquals("hi", decoded.getText());
        assertEquals(TextEncoding.UTF_8_BOM, decoded.getEncoding());
    }

    @Test
    void utf16LittleEndianIsDetectedFromItsMark() {
        TextEncoding.DecodedText decoded = TextEncoding.decode(TextEncoding.UTF_16LE.encode("é"), TextEncoding.UTF_8);

        assertEquals("é", decoded.getText());
        assertEquals(TextEncoding.UTF_16LE, decoded.getEncoding());
    }

    @Test
    void bytesWithoutMarkUseTheFallback() {
        byte[] latin1 = "é".getBytes(StandardCharsets.ISO_8859_1);

        TextEncoding.DecodedText decoded = TextEncoding.decode(latin1, TextEncoding.LATIN_1);

        assertEquals("é", decoded.getText());
        assertEquals(TextEncoding.LATIN_1, decoded.getEncoding());
        assertEquals(1, TextEncoding.LATIN_1.encode("é").length);
    }
}
