package com.meteocache.codec;

import com.meteocache.exception.DecodingException;
import com.meteocache.exception.EncodingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.util.Arrays;

/**
 * Lossless conversion between unicode text and the supported byte encodings.
 *
 * Encoding and strict decoding report malformed or unmappable input instead of
 * substituting characters, so a round trip either reproduces the text exactly or fails.
 */
@Slf4j
@Component
public class TextCodec {

    /**
     * Fraction of dense-script code points above which UTF-16 is chosen.
     */
    static final double DENSE_SCRIPT_THRESHOLD = 0.5;

    /**
     * Encode text with the given encoding.
     *
     * @throws EncodingException if the text contains code points the encoding cannot represent
     */
    public EncodedText encode(String text, TextEncoding encoding) {
        if (text == null) {
            throw new EncodingException("Text must not be null");
        }
        if (encoding == null) {
            throw new EncodingException("Encoding must not be null");
        }

        try {
            ByteBuffer buffer = encoding.getCharset().newEncoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .encode(CharBuffer.wrap(text));

            byte[] bytes = Arrays.copyOfRange(buffer.array(), buffer.position(), buffer.limit());
            return new EncodedText(bytes, bytes.length, encoding);

        } catch (CharacterCodingException e) {
            throw new EncodingException(
                    "Cannot encode text with " + encoding + ". Consider utf-8 or utf-16", e);
        }
    }

    /**
     * Encode text with an encoding given by name.
     */
    public EncodedText encode(String text, String encodingName) {
        return encode(text, TextEncoding.fromName(encodingName));
    }

    /**
     * Strictly decode bytes with the given encoding.
     *
     * @throws DecodingException if the bytes are not valid for the encoding
     */
    public String decode(byte[] bytes, TextEncoding encoding) {
        if (bytes == null) {
            throw new DecodingException("Bytes must not be null");
        }
        if (encoding == null) {
            throw new DecodingException("Encoding must not be null");
        }

        try {
            return encoding.getCharset().newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new DecodingException(
                    "Cannot decode " + bytes.length + " bytes with " + encoding + ". Data may be corrupted", e);
        }
    }

    /**
     * Decode bytes, falling back to U+FFFD substitution when strict decoding fails.
     * The result records whether any substitution happened.
     */
    public DecodedText decodeLenient(byte[] bytes, TextEncoding encoding) {
        try {
            return new DecodedText(decode(bytes, encoding), false);
        } catch (DecodingException e) {
            log.warn("Strict decode with {} failed, substituting invalid sequences: {}",
                    encoding, e.getMessage());
        }

        try {
            String text = encoding.getCharset().newDecoder()
                    .onMalformedInput(CodingErrorAction.REPLACE)
                    .onUnmappableCharacter(CodingErrorAction.REPLACE)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
            return new DecodedText(text, true);
        } catch (CharacterCodingException e) {
            throw new DecodingException("Cannot decode text with " + encoding, e);
        }
    }

    /**
     * Pick the default encoding for a text.
     *
     * Counts code points in the CJK unified ideographs, hiragana, katakana and hangul
     * syllable blocks; more than half of them selects UTF-16, anything else UTF-8.
     */
    public TextEncoding detectDefaultEncoding(String text) {
        if (text == null || text.isEmpty()) {
            return TextEncoding.UTF_8;
        }

        long total = text.codePoints().count();
        long dense = text.codePoints().filter(TextCodec::isDenseScript).count();

        if ((double) dense / total > DENSE_SCRIPT_THRESHOLD) {
            return TextEncoding.UTF_16;
        }
        return TextEncoding.UTF_8;
    }

    static boolean isDenseScript(int codePoint) {
        return (codePoint >= 0x4E00 && codePoint <= 0x9FFF)      // CJK unified ideographs
                || (codePoint >= 0x3040 && codePoint <= 0x309F)  // Hiragana
                || (codePoint >= 0x30A0 && codePoint <= 0x30FF)  // Katakana
                || (codePoint >= 0xAC00 && codePoint <= 0xD7AF); // Hangul syllables
    }
}
