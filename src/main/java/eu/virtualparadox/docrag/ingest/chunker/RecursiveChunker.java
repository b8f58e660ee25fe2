package eu.virtualparadox.docrag.ingest.chunker;

import eu.virtualparadox.docrag.exception.ConfigurationException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * Separator-driven text {@code RecursiveChunker} that produces overlapping segments for retrieval.
 *
 * <h2>Overview</h2>
 * <ul>
 *   <li><strong>Separator priority:</strong> the text is split on the first separator of
 *       {@link #DEFAULT_SEPARATORS} that occurs in it: paragraph breaks, then line breaks, then
 *       spaces, and finally single characters.</li>
 *   <li><strong>Packing:</strong> pieces that fit are greedily packed into a chunk of at most
 *       {@code chunkSize} characters, re-joined with the separator they were split on.</li>
 *   <li><strong>Overlap:</strong> when a chunk is closed, the trailing pieces totalling at most
 *       {@code overlap} characters (separators included) seed the next chunk.</li>
 *   <li><strong>Recursion:</strong> a piece longer than {@code chunkSize} is split again with the
 *       remaining, finer separators. If no separator is left, the piece is emitted oversized.</li>
 * </ul>
 *
 * <h2>Determinism &amp; Thread-safety</h2>
 * This component is stateless after construction. For a given input text the output is always
 * the same sequence of trimmed, non-empty chunks.
 */
@Component
public class RecursiveChunker {

    /**
     * Paragraph break, line break, word boundary, raw character.
     */
    public static final List<String> DEFAULT_SEPARATORS = List.of("\n\n", "\n", " ", "");

    /**
     * Upper bound on a chunk's length, exceeded only by pieces no separator can split.
     */
    private final int chunkSize;

    /**
     * Maximum number of characters shared by consecutive chunks.
     */
    private final int overlap;

    private final List<String> separators;

    /**
     * Constructs a chunker with {@link #DEFAULT_SEPARATORS}.
     *
     * @param chunkSize maximum chunk length, must be {@code > 0}
     * @param overlap   shared characters between neighbours, {@code 0 <= overlap < chunkSize}
     * @throws ConfigurationException if constraints are violated
     */
    @Autowired
    public RecursiveChunker(@Value("${docrag.chunker.size:1000}") final int chunkSize,
                            @Value("${docrag.chunker.overlap:100}") final int overlap) {
        this(chunkSize, overlap, DEFAULT_SEPARATORS);
    }

    /**
     * Constructs a chunker with a custom separator priority list.
     * <p>
     * A list that does not end with the empty separator allows oversized chunks for regions
     * none of the separators can break.
     *
     * @param chunkSize  maximum chunk length, must be {@code > 0}
     * @param overlap    shared characters between neighbours, {@code 0 <= overlap < chunkSize}
     * @param separators separators in priority order (non-empty)
     * @throws ConfigurationException if constraints are violated
     */
    public RecursiveChunker(final int chunkSize,
                            final int overlap,
                            final List<String> separators) {
        if (chunkSize <= 0) {
            throw new ConfigurationException("chunkSize must be positive, got " + chunkSize);
        }
        if (overlap < 0 || overlap >= chunkSize) {
            throw new ConfigurationException(
                    "overlap must be non-negative and less than chunkSize (overlap=" + overlap
                            + ", chunkSize=" + chunkSize + ")");
        }
        if (separators == null || separators.isEmpty()) {
            throw new ConfigurationException("at least one separator is required");
        }
        this.chunkSize = chunkSize;
        this.overlap = overlap;
        this.separators = List.copyOf(separators);
    }

    /**
     * Splits {@code text} into ordered, overlapping chunks.
     *
     * @param text input text (non-null, may be empty)
     * @return chunks in document order; empty for blank input
     * @throws IllegalArgumentException if {@code text} is null
     */
    public List<String> chunk(final String text) {
        if (text == null) {
            throw new IllegalArgumentException("text cannot be null");
        }
        if (text.isBlank()) {
            return Collections.emptyList();
        }
        return Collections.unmodifiableList(split(text, separators));
    }

    public int getChunkSize() {
        return chunkSize;
    }

    public int getOverlap() {
        return overlap;
    }

    /**
     * Splits with the first applicable separator and recurses into pieces that are still too long.
     *
     * @param text       text to split
     * @param candidates separators still available at this depth
     * @return chunks for {@code text}
     */
    private List<String> split(final String text, final List<String> candidates) {
        String separator = candidates.get(candidates.size() - 1);
        List<String> finer = Collections.emptyList();

        for (int i = 0; i < candidates.size(); i++) {
            final String candidate = candidates.get(i);
            if (candidate.isEmpty()) {
                separator = candidate;
                break;
            }
            if (text.contains(candidate)) {
                separator = candidate;
                finer = candidates.subList(i + 1, candidates.size());
                break;
            }
        }

        final List<String> result = new ArrayList<>();
        final List<String> fitting = new ArrayList<>();

        for (final String piece : splitOn(text, separator)) {
            if (piece.length() <= chunkSize) {
                fitting.add(piece);
                continue;
            }

            // Flush what fits so far to keep document order.
            if (!fitting.isEmpty()) {
                result.addAll(merge(fitting, separator));
                fitting.clear();
            }

            if (finer.isEmpty()) {
                addChunk(result, piece);
            } else {
                result.addAll(split(piece, finer));
            }
        }

        if (!fitting.isEmpty()) {
            result.addAll(merge(fitting, separator));
        }
        return result;
    }

    /**
     * Greedily packs pieces into chunks, carrying up to {@code overlap} trailing characters forward.
     *
     * @param pieces    pieces no longer than {@code chunkSize}
     * @param separator separator used to re-join pieces
     * @return packed chunks
     */
    private List<String> merge(final List<String> pieces, final String separator) {
        final int separatorLength = separator.length();
        final List<String> chunks = new ArrayList<>();
        final Deque<String> window = new ArrayDeque<>();
        // sum of piece lengths in the window plus the separators between them
        int total = 0;

        for (final String piece : pieces) {
            final int length = piece.length();

            if (total + length + (window.isEmpty() ? 0 : separatorLength) > chunkSize && !window.isEmpty()) {
                addChunk(chunks, String.join(separator, window));

                while (total > overlap
                        || (total > 0 && total + length + (window.isEmpty() ? 0 : separatorLength) > chunkSize)) {
                    final int dropped = window.peekFirst().length() + (window.size() > 1 ? separatorLength : 0);
                    window.pollFirst();
                    total -= dropped;
                }
            }

            window.addLast(piece);
            total += length + (window.size() > 1 ? separatorLength : 0);
        }

        if (!window.isEmpty()) {
            addChunk(chunks, String.join(separator, window));
        }
        return chunks;
    }

    private static void addChunk(final List<String> chunks, final String chunk) {
        final String trimmed = chunk.trim();
        if (!trimmed.isEmpty()) {
            chunks.add(trimmed);
        }
    }

    /**
     * Splits on a literal separator, dropping empty pieces. The empty separator yields code points.
     */
    private static List<String> splitOn(final String text, final String separator) {
        final List<String> pieces = new ArrayList<>();
        if (separator.isEmpty()) {
            text.codePoints().forEach(cp -> pieces.add(new String(Character.toChars(cp))));
            return pieces;
        }

        int start = 0;
        int next;
        while ((next = text.indexOf(separator, start)) >= 0) {
            if (next > start) {
                pieces.add(text.substring(start, next));
            }
            start = next + separator.length();
        }
        if (start < text.length()) {
            pieces.add(text.substring(start));
        }
        return pieces;
    }
}
