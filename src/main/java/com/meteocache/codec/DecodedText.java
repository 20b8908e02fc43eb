package com.meteocache.codec;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Text produced by a lenient decode.
 * {@code substituted} is true when malformed input was replaced with U+FFFD.
 */
@Data
@AllArgsConstructor
public class DecodedText {
    private String text;
    private boolean substituted;
}
