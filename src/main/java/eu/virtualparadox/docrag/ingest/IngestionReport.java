package eu.virtualparadox.docrag.ingest;

import eu.virtualparadox.docrag.rag.index.IndexHandle;

/**
 * Outcome of a completed ingestion run.
 *
 * @param runId    catalog id of the run
 * @param segments number of segments persisted and indexed
 * @param handle   handle of the freshly built index generation
 */
public record IngestionReport(String runId, int segments, IndexHandle handle) {
}
