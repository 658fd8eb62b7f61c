package com.zzf.optrace.trace.view;

import java.nio.charset.Charset;

/**
 * Transcodes statement text into the character set the view is rendered in.
 */
@FunctionalInterface
public interface CharsetConverter {
    String convert(byte[] text, Charset from, Charset to);
}
