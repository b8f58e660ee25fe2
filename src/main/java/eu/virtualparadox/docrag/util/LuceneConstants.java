package eu.virtualparadox.docrag.util;

import org.apache.lucene.index.VectorSimilarityFunction;

public class LuceneConstants {
    public static final String FIELD_VECTOR = "_vector";
    public static final VectorSimilarityFunction VECTOR_SIMILARITY = VectorSimilarityFunction.COSINE;

    private LuceneConstants() {
        // prevent instantiation
    }
}
