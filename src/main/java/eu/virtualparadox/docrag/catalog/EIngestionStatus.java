package eu.virtualparadox.docrag.catalog;

public enum EIngestionStatus {
    RUNNING,
    INDEXED,
    FAILED
}
