package com.zzf.optrace.trace.view;

import org.junit.jupiter.api.Test;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.assertEquals;

class JdkCharsetConverterTest {

    private final JdkCharsetConverter converter = new JdkCharsetConverter();

    @Test
    void decodesWithSourceCharset() {
        byte[] sjis = "SELECT '日本'".getBytes(Charset.forName("Shift_JIS"));
        assertEquals("SELECT '日本'", converter.convert(sjis, Charset.forName("Shift_JIS"), StandardCharsets.UTF_8));
    }

    @Test
    void unmappableCharactersAreReplaced() {
        byte[] utf8 = "a→b".getBytes(StandardCharsets.UTF_8);
        assertEquals("a?b", converter.convert(utf8, StandardCharsets.UTF_8, StandardCharsets.ISO_8859_1));
    }

    @Test
    void emptyInputGivesEmptyText() {
        assertEquals("", converter.convert(new byte[0], StandardCharsets.UTF_8, StandardCharsets.UTF_8));
        assertEquals("", converter.convert(null, null, null));
    }
}
