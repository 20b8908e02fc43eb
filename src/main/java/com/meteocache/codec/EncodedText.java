package com.meteocache.codec;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Result of encoding forecast text: the raw bytes, their length and the encoding applied.
 */
@Data
@AllArgsConstructor
public class EncodedText {
    private byte[] bytes;
    private int byteLength;
    private TextEncoding encoding;
}
