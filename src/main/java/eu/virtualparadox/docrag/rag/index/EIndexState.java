package eu.virtualparadox.docrag.rag.index;

public enum EIndexState {
    ABSENT,
    BUILDING,
    READY,
    STALE
}
