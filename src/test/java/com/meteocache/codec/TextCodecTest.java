package com.meteocache.codec;

import com.meteocache.exception.DecodingException;
import com.meteocache.exception.EncodingException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for TextCodec.
 */
class TextCodecTest {

    private TextCodec textCodec;

    @BeforeEach
    void setUp() {
        textCodec = new TextCodec();
    }

    @Test
    void testRoundTripInEveryEncoding() {
        String text = "Sunny, 22°C. 晴れ、最高気温22度。맑음";

        for (TextEncoding encoding : TextEncoding.values()) {
            EncodedText encoded = textCodec.encode(text, encoding);
            assertEquals(encoded.getBytes().length, encoded.getByteLength());
            assertEquals(encoding, encoded.getEncoding());
            assertEquals(text, textCodec.decode(encoded.getBytes(), encoding), "round trip via " + encoding);
        }
    }

    @Test
    void testUtf8ByteLength() {
        EncodedText encoded = textCodec.encode("Café", TextEncoding.UTF_8);

        assertEquals(5, encoded.getByteLength());
        assertArrayEquals("Café".getBytes(StandardCharsets.UTF_8), encoded.getBytes());
    }

    @Test
    void testEncodeByName() {
        EncodedText encoded = textCodec.encode("Rain", "UTF8");

        assertEquals(TextEncoding.UTF_8, encoded.getEncoding());
    }

    @Test
    void testUnknownEncodingNameRejected() {
        EncodingException e = assertThrows(EncodingException.class, () -> textCodec.encode("Rain", "latin-1"));
        assertTrue(e.getMessage().contains("utf-8"));
    }

    @Test
    void testEmptyTextEncodesToZeroBytes() {
        EncodedText encoded = textCodec.encode("", TextEncoding.UTF_8);

        assertEquals(0, encoded.getByteLength());
        assertEquals("", textCodec.decode(encoded.getBytes(), TextEncoding.UTF_8));
    }

    @Test
    void testUnpairedSurrogateCannotBeEncoded() {
        assertThrows(EncodingException.class, () -> textCodec.encode("bad \uD800 text", TextEncoding.UTF_8));
    }

    @Test
    void testInvalidBytesFailStrictDecode() {
        byte[] invalid = {(byte) 0xC3, (byte) 0x28};

        assertThrows(DecodingException.class, () -> textCodec.decode(invalid, TextEncoding.UTF_8));
    }

    @Test
    void testLenientDecodeSubstitutesInvalidBytes() {
        byte[] invalid = {'o', 'k', (byte) 0xFF};

        DecodedText decoded = textCodec.decodeLenient(invalid, TextEncoding.UTF_8);

        assertTrue(decoded.isSubstituted());
        assertTrue(decoded.getText().startsWith("ok"));
        assertTrue(decoded.getText().contains("�"));
    }

    @Test
    void testLenientDecodeOfValidBytesIsNotSubstituted() {
        DecodedText decoded = textCodec.decodeLenient("clear".getBytes(StandardCharsets.UTF_8), TextEncoding.UTF_8);

        assertFalse(decoded.isSubstituted());
        assertEquals("clear", decoded.getText());
    }

    @Test
    void testDetectDefaultEncoding() {
        assertEquals(TextEncoding.UTF_8, textCodec.detectDefaultEncoding(""));
        assertEquals(TextEncoding.UTF_8, textCodec.detectDefaultEncoding("Partly cloudy with light winds"));
        assertEquals(TextEncoding.UTF_16, textCodec.detectDefaultEncoding("今日は晴れです"));
        assertEquals(TextEncoding.UTF_16, textCodec.detectDefaultEncoding("오늘은 맑음"));
    }

    @Test
    void testDetectionThresholdIsStrictlyMoreThanHalf() {
        // two dense code points out of four
        assertEquals(TextEncoding.UTF_8, textCodec.detectDefaultEncoding("晴れab"));
        // three out of five
        assertEquals(TextEncoding.UTF_16, textCodec.detectDefaultEncoding("晴れ雨ab"));
    }

    @Test
    void testDenseScriptRanges() {
        assertTrue(TextCodec.isDenseScript(0x4E00));
        assertTrue(TextCodec.isDenseScript(0x3042));
        assertTrue(TextCodec.isDenseScript(0x30A2));
        assertTrue(TextCodec.isDenseScript(0xAC00));
        assertFalse(TextCodec.isDenseScript('A'));
        assertFalse(TextCodec.isDenseScript(0x3000));
    }

    @Test
    void testStoredNames() {
        assertEquals("utf-8", TextEncoding.UTF_8.getStoredName());
        assertEquals(TextEncoding.UTF_16, TextEncoding.fromName("utf-16"));
        assertEquals(TextEncoding.UTF_32, TextEncoding.fromName("UTF_32"));
    }
}
