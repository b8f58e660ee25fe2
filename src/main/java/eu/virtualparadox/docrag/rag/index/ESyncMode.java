package eu.virtualparadox.docrag.rag.index;

public enum ESyncMode {
    /** The index converges only when a sync is explicitly triggered. */
    TRIGGERED,
    /** The index follows every store write on its own. */
    CONTINUOUS
}
