package de.entwicklertraining.memory.client.streaming;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class NdjsonDecoderTest {

    @Test
    @DisplayName("Complete lines are emitted as soon as their newline arrives")
    void testSplitsLines() {
        NdjsonDecoder decoder = new NdjsonDecoder();

        List<String> first = decoder.accept(bytes("{\"key\":\"a\"}\n{\"ke"));
        List<String> second = decoder.accept(bytes("y\":\"b\"}\n"));

        assertEquals(List.of("{\"key\":\"a\"}"), first);
        assertEquals(List.of("{\"key\":\"b\"}"), second);
        assertEquals(0, decoder.bufferedLength());
        assertEquals(Optional.empty(), decoder.finish());
    }

    @Test
    @DisplayName("Multi-byte characters split across chunks are reassembled")
    void testSplitMultiByteCharacter() {
        byte[] line = bytes("{\"v\":\"ä€😀\"}\n");
        NdjsonDecoder decoder = new NdjsonDecoder();
        List<String> lines = new ArrayList<>();

        // one byte at a time splits every multi-byte sequence
        for (byte b : line) {
            lines.addAll(decoder.accept(new byte[]{b}));
        }

        assertEquals(List.of("{\"v\":\"ä€😀\"}"), lines);
    }

    @Test
    @DisplayName("Blank lines are skipped and CRLF endings are accepted")
    void testBlankLinesAndCrlf() {
        NdjsonDecoder decoder = new NdjsonDecoder();

        List<String> lines = decoder.accept(bytes("\n  \n1\r\n\r\n2\n"));

        assertEquals(List.of("1", "2"), lines);
    }

    @Test
    @DisplayName("The fragment after the last newline is returned by finish")
    void testTrailingFragment() {
        NdjsonDecoder decoder = new NdjsonDecoder();
        decoder.accept(bytes("1\n{\"key\":"));

        assertEquals(7, decoder.bufferedLength());
        assertEquals(Optional.of("{\"key\":"), decoder.finish());
        assertTrue(decoder.isFinished());
    }

    @Test
    @DisplayName("An incomplete multi-byte sequence at end of input becomes a replacement character")
    void testTruncatedMultiByteAtEnd() {
        byte[] euro = "€".getBytes(StandardCharsets.UTF_8);
        NdjsonDecoder decoder = new NdjsonDecoder();

        assertEquals(List.of(), decoder.accept(Arrays.copyOf(euro, 2)));
        assertEquals(Optional.of("�"), decoder.finish());
    }

    @Test
    @DisplayName("The decoder can be finished only once")
    void testFinishOnce() {
        NdjsonDecoder decoder = new NdjsonDecoder();
        decoder.finish();

        assertThrows(IllegalStateException.class, decoder::finish);
        assertThrows(IllegalStateException.class, () -> decoder.accept(bytes("1\n")));
    }

    private static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }
}
