package eu.virtualparadox.docrag.rag.index;

import java.util.Map;

/**
 * One ranked hit of an index query.
 *
 * @param fields requested columns only, keyed by column name
 * @param score  similarity score, higher is better
 */
public record IndexedRow(Map<String, Object> fields, float score) {
}
