package eu.virtualparadox.docrag.ingest.chunker;

import eu.virtualparadox.docrag.exception.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class RecursiveChunkerTest {

    // ---------- Helpers ----------

    /**
     * Paragraphs of random lowercase words (5-9 letters), words joined by spaces, paragraphs by blank lines.
     */
    private static String buildParagraphs(int paragraphs, int minWords, int maxWords) {
        Random rnd = new Random(123);
        StringBuilder sb = new StringBuilder();
        for (int p = 0; p < paragraphs; p++) {
            if (p > 0) {
                sb.append("\n\n");
            }
            int words = minWords + rnd.nextInt(maxWords - minWords + 1);
            for (int w = 0; w < words; w++) {
                if (w > 0) {
                    sb.append(' ');
                }
                sb.append(randomWord(rnd));
            }
        }
        return sb.toString();
    }

    private static String randomWord(Random rnd) {
        int len = 5 + rnd.nextInt(5);
        StringBuilder s = new StringBuilder(len);
        for (int i = 0; i < len; i++) {
            s.append((char) ('a' + rnd.nextInt(26)));
        }
        return s.toString();
    }

    private static String stripWhitespace(String s) {
        return s.replaceAll("\\s+", "");
    }

    /**
     * Walks the chunks over the original (whitespace removed) and checks that every chunk starts
     * no later than the end of its predecessor, shares at most {@code overlap} characters with it,
     * and that the last chunk reaches the end of the text.
     */
    private static void assertCoversWithoutGaps(String text, List<String> chunks, int overlap) {
        String original = stripWhitespace(text);
        int prevEnd = 0;
        for (int i = 0; i < chunks.size(); i++) {
            String seg = stripWhitespace(chunks.get(i));
            int from = Math.max(0, prevEnd - overlap);
            int pos = original.indexOf(seg, from);

            assertTrue(pos >= 0, "Chunk " + i + " not found in order");
            assertTrue(pos <= prevEnd, "Gap before chunk " + i);
            assertTrue(prevEnd - pos <= overlap, "Chunk " + i + " overlaps more than " + overlap);

            prevEnd = Math.max(prevEnd, pos + seg.length());
        }
        assertEquals(original.length(), prevEnd, "Chunks must reach the end of the text");
    }

    // ---------- Tests ----------

    @Test
    @DisplayName("Invalid size or overlap is rejected at construction")
    void invalidConfiguration() {
        assertThrows(ConfigurationException.class, () -> new RecursiveChunker(0, 0));
        assertThrows(ConfigurationException.class, () -> new RecursiveChunker(-5, 0));
        assertThrows(ConfigurationException.class, () -> new RecursiveChunker(10, 10));
        assertThrows(ConfigurationException.class, () -> new RecursiveChunker(10, -1));
    }

    @Test
    @DisplayName("Null text is rejected, blank text yields no chunks")
    void blankOrNull() {
        RecursiveChunker chunker = new RecursiveChunker(100, 10);
        assertThrows(IllegalArgumentException.class, () -> chunker.chunk(null));
        assertTrue(chunker.chunk("").isEmpty());
        assertTrue(chunker.chunk("  \n\n \t ").isEmpty());
    }

    @Test
    @DisplayName("Short text yields one trimmed chunk")
    void shortText() {
        RecursiveChunker chunker = new RecursiveChunker(100, 10);
        assertEquals(List.of("Hello world."), chunker.chunk("  Hello world.\n"));
    }

    @Test
    @DisplayName("Paragraph breaks are preferred over other separators")
    void splitsOnParagraphs() {
        RecursiveChunker chunker = new RecursiveChunker(5, 0);
        assertEquals(List.of("A.", "B.", "C."), chunker.chunk("A.\n\nB.\n\nC."));
    }

    /**
     * Single-line input: the sentences share one line, so the word separator packs two of them
     * into the first chunk. Three one-sentence chunks come from paragraph-separated input, see
     * {@link #splitsOnParagraphs()}.
     */
    @Test
    @DisplayName("Words on a single line are packed greedily up to the size limit")
    void packsWordsOnSingleLine() {
        RecursiveChunker chunker = new RecursiveChunker(5, 0);
        assertEquals(List.of("A. B.", "C."), chunker.chunk("A. B. C."));

        RecursiveChunker tight = new RecursiveChunker(3, 0);
        assertEquals(List.of("A.", "B.", "C."), tight.chunk("A. B. C."));
    }

    @Test
    @DisplayName("Text without separators is cut into characters and repacked")
    void characterFallback() {
        RecursiveChunker chunker = new RecursiveChunker(10, 0);
        assertEquals(List.of("abcdefghij", "klmnopqrst", "uvwxyz"), chunker.chunk("abcdefghijklmnopqrstuvwxyz"));

        RecursiveChunker overlapping = new RecursiveChunker(10, 3);
        List<String> chunks = overlapping.chunk("abcdefghijklmnopqrstuvwxyz");
        assertEquals("abcdefghij", chunks.get(0));
        assertTrue(chunks.get(1).startsWith("hij"));
        assertTrue(chunks.get(chunks.size() - 1).endsWith("xyz"));
    }

    @Test
    @DisplayName("A piece no separator can break is emitted oversized")
    void oversizedPieceWithoutFinerSeparator() {
        RecursiveChunker chunker = new RecursiveChunker(10, 0, List.of("\n\n"));
        String longPiece = "x".repeat(30);

        List<String> chunks = chunker.chunk("short\n\n" + longPiece + "\n\nend");

        assertEquals(List.of("short", longPiece, "end"), chunks);
    }

    @Test
    @DisplayName("With the default separators no chunk exceeds the size limit")
    void respectsSizeLimit() {
        RecursiveChunker chunker = new RecursiveChunker(200, 50);
        List<String> chunks = chunker.chunk(buildParagraphs(40, 5, 60));

        assertTrue(chunks.size() > 1);
        for (String c : chunks) {
            assertTrue(c.length() <= 200, "Chunk too long: " + c.length());
            assertFalse(c.isBlank());
            assertEquals(c.trim(), c);
        }
    }

    @Test
    @DisplayName("Chunks cover the whole text in order, overlapping by at most the configured amount")
    void coversTextWithoutGaps() {
        String text = buildParagraphs(40, 5, 60);

        assertCoversWithoutGaps(text, new RecursiveChunker(200, 50).chunk(text), 50);
        assertCoversWithoutGaps(text, new RecursiveChunker(200, 0).chunk(text), 0);
        assertCoversWithoutGaps(text, new RecursiveChunker(120, 30).chunk(text), 30);
    }

    @Test
    @DisplayName("Consecutive chunks of one paragraph share a bounded prefix/suffix")
    void overlapIsCarriedForward() {
        int overlap = 50;
        RecursiveChunker chunker = new RecursiveChunker(200, overlap);
        List<String> chunks = chunker.chunk(buildParagraphs(1, 150, 150));

        assertTrue(chunks.size() > 2);
        for (int i = 1; i < chunks.size(); i++) {
            String prev = chunks.get(i - 1);
            String next = chunks.get(i);

            boolean shared = false;
            for (int len = Math.min(overlap, next.length()); len > 0; len--) {
                if (prev.endsWith(next.substring(0, len))) {
                    shared = true;
                    break;
                }
            }
            assertTrue(shared, "Chunk " + i + " should start with the tail of chunk " + (i - 1));
        }
    }

    @Test
    @DisplayName("Chunking is deterministic")
    void deterministic() {
        String text = buildParagraphs(20, 5, 40);
        RecursiveChunker chunker = new RecursiveChunker(150, 20);
        assertEquals(chunker.chunk(text), chunker.chunk(text));
    }
}
