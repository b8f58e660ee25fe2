package eu.virtualparadox.docrag.ingest.extractor;

import java.nio.file.Path;

/**
 * Converts a source document into one text blob.
 */
public interface TextExtractor {

    /**
     * @param source document on disk
     * @return {@code true} if this extractor can read the given file
     */
    boolean supports(final Path source);

    /**
     * Extracts the full text of the document.
     *
     * @param source document on disk
     * @return document text, possibly empty, never null
     * @throws IllegalStateException if the document cannot be read
     */
    String extract(final Path source);
}
