package com.zzf.optrace.trace.view;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CharsetEncoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Decodes with the source charset and round-trips through the target one,
 * so characters the target cannot hold come out as its replacement character.
 */
public class JdkCharsetConverter implements CharsetConverter {

    @Override
    public String convert(byte[] text, Charset from, Charset to) {
        if (text == null || text.length == 0) {
            return "";
        }
        Charset source = from == null ? StandardCharsets.UTF_8 : from;
        String decoded = new String(text, source);
        if (to == null || to.equals(source)) {
            return decoded;
        }
        CharsetEncoder encoder = to.newEncoder()
                .onMalformedInput(CodingErrorAction.REPLACE)
                .onUnmappableCharacter(CodingErrorAction.REPLACE);
        try {
            ByteBuffer encoded = encoder.encode(CharBuffer.wrap(decoded));
            return to.decode(encoded).toString();
        } catch (CharacterCodingException e) {
            // unreachable with REPLACE actions
            throw new IllegalStateException(e);
        }
    }
}
