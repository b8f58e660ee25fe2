package eu.virtualparadox.docrag.ingest.identity;

import eu.virtualparadox.docrag.ingest.model.Segment;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Assigns sequential primary keys {@code 1..N} to chunker output, in input order.
 * <p>
 * Ids are positional, so the same input always yields the same ids.
 */
@Component
public class SegmentIdAssigner {

    /**
     * @param chunks chunk texts in document order (non-null, no null elements)
     * @return segments with ids forming the contiguous range {@code [1, chunks.size()]}
     */
    public List<Segment> assignIds(final List<String> chunks) {
        if (chunks == null) {
            throw new IllegalArgumentException("chunks cannot be null");
        }

        final List<Segment> segments = new ArrayList<>(chunks.size());
        long nextId = 1;
        for (final String chunk : chunks) {
            segments.add(new Segment(nextId++, chunk));
        }
        return Collections.unmodifiableList(segments);
    }
}
