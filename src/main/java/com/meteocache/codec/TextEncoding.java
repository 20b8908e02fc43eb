package com.meteocache.codec;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.meteocache.exception.EncodingException;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Text encodings supported for stored forecast text.
 *
 * The stored name (utf-8, utf-16, utf-32) is what lands in the text_encoding column,
 * so rows written by other clients of the same table stay readable.
 */
public enum TextEncoding {
    /**
     * Universal variable-width encoding, recommended for most languages.
     */
    UTF_8("utf-8", StandardCharsets.UTF_8),

    /**
     * Denser for Chinese, Japanese and Korean text. Written with a byte-order mark.
     */
    UTF_16("utf-16", StandardCharsets.UTF_16),

    /**
     * Fixed-width unicode.
     */
    UTF_32("utf-32", Charset.forName("UTF-32"));

    private final String storedName;
    private final Charset charset;

    TextEncoding(String storedName, Charset charset) {
        this.storedName = storedName;
        this.charset = charset;
    }

    @JsonValue
    public String getStoredName() {
        return storedName;
    }

    public Charset getCharset() {
        return charset;
    }

    /**
     * Resolve an encoding name such as "utf-8", "UTF8" or "utf_16".
     *
     * @throws EncodingException if the name is not one of the supported encodings
     */
    @JsonCreator
    public static TextEncoding fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new EncodingException("Encoding name must not be empty");
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (TextEncoding encoding : values()) {
            if (encoding.storedName.equals(normalized)
                    || encoding.storedName.replace("-", "").equals(normalized)) {
                return encoding;
            }
        }
        throw new EncodingException("Unsupported encoding: " + name + ". Supported: " + supportedNames());
    }

    public static String supportedNames() {
        return Arrays.stream(values())
                .map(TextEncoding::getStoredName)
                .collect(Collectors.joining(", "));
    }

    @Override
    public String toString() {
        return storedName;
    }
}
