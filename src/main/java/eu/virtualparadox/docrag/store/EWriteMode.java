package eu.virtualparadox.docrag.store;

public enum EWriteMode {
    /** Replace every row of the location in one batch. */
    OVERWRITE,
    /** Add rows next to the existing ones. */
    APPEND
}
