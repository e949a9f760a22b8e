package com.codestyle.workspace;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * Charset of a document on disk together with whether it is written with a byte order mark.
 */
public final class TextEncoding {
    public static final TextEncoding UTF_8 = new TextEncoding(StandardCharsets.UTF_8, false);
    public static final TextEncoding UTF_8_BOM = new TextEncoding(StandardCharsets.UTF_8, true);
    public static final TextEncoding UTF_16BE = new TextEncoding(StandardCharsets.UTF_16BE, true);
    public static final TextEncoding UTF_16LE = new TextEncoding(StandardCharsets.UTF_16LE, true);
    public static final TextEncoding LATIN_1 = new TextEncoding(StandardCharsets.ISO_8859_1, false);

    private static final byte[] UTF_8_PREAMBLE = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF};
    private static final byte[] UTF_16BE_PREAMBLE = {(byte) 0xFE, (byte) 0xFF};
    private static final byte[] UTF_16LE_PREAMBLE = {(byte) 0xFF, (byte) 0xFE};

    private final Charset charset;
    private final boolean byteOrderMark;

    public TextEncoding(Charset charset, boolean byteOrderMark) {
        this.charset = Objects.requireNonNull(charset, "charset");
        this.byteOrderMark = byteOrderMark;
    }

    public Charset getCharset() {
        return charset;
    }

    public boolean hasByteOrderMark() {
        return byteOrderMark;
    }

    /**
     * Maps an editorconfig style {@code charset} value to an encoding. Unknown values map to UTF-8.
     */
    public static TextEncoding fromCharsetOption(String charsetOption) {
        if (charsetOption == null) {
            return UTF_8;
        }
        return switch (charsetOption.trim().toLowerCase()) {
            case "latin1" -> LATIN_1;
            case "utf-8-bom" -> UTF_8_BOM;
            case "utf-16be" -> UTF_16BE;
            case "utf-16le" -> UTF_16LE;
            default -> UTF_8;
        };
    }

    /**
     * Decodes file content, honouring a leading byte order mark over {@code fallback}.
     */
    public static DecodedText decode(byte[] bytes, TextEncoding fallback) {
        if (startsWith(bytes, UTF_8_PREAMBLE)) {
            return new DecodedText(new String(bytes, 3, bytes.length - 3, StandardCharsets.UTF_8), UTF_8_BOM);
        }
        if (startsWith(bytes, UTF_16BE_PREAMBLE)) {
            return new DecodedText(new String(bytes, 2, bytes.length - 2, StandardCharsets.UTF_16BE), UTF_16BE);
        }
        if (startsWith(bytes, UTF_16LE_PREAMBLE)) {
            return new DecodedText(new String(bytes, 2, bytes.length - 2, StandardCharsets.UTF_16LE), UTF_16LE);
        }
        return new DecodedText(new String(bytes, fallback.charset), fallback);
    }

    /**
     * Encodes text, prefixed by the byte order mark when this encoding carries one.
     */
    public byte[] encode(String text) {
        byte[] body = text.getBytes(charset);
        byte[] preamble = getPreamble();
        if (preamble.length == 0) {
            return body;
        }
        byte[] result = Arrays.copyOf(preamble, preamble.length + body.length);
        System.arraycopy(body, 0, result, preamble.length, body.length);
        return result;
    }

    private byte[] getPreamble() {
        if (!byteOrderMark) {
            return new byte[0];
        }
        if (charset.equals(StandardCharsets.UTF_8)) {
            return UTF_8_PREAMBLE.clone();
        }
        if (charset.equals(StandardCharsets.UTF_16BE)) {
            return UTF_16BE_PREAMBLE.clone();
        }
        if (charset.equals(StandardCharsets.UTF_16LE)) {
            return UTF_16LE_PREAMBLE.clone();
        }
        return new byte[0];
    }

    private static boolean startsWith(byte[] bytes, byte[] prefix) {
        if (bytes.length < prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if (bytes[i] != prefix[i]) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TextEncoding)) return false;
        TextEncoding that = (TextEncoding) o;
        return byteOrderMark == that.byteOrderMark && charset.equals(that.charset);
    }

    @Override
    public int hashCode() {
        return Objects.hash(charset, byteOrderMark);
    }

    @Override
    public String toString() {
        return charset.name() + (byteOrderMark ? " (BOM)" : "");
    }

    /**
     * Text decoded from bytes and the encoding it was found in.
     */
    public static final class DecodedText {
        private final String text;
        private final TextEncoding encoding;

        DecodedText(String text, TextEncoding encoding) {
            this.text = text;
            this.encoding = encoding;
        }

        public String getText() {
            return text;
        }

        public TextEncoding getEncoding() {
            return encoding;
        }
    }
}
