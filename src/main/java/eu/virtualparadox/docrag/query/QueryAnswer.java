package eu.virtualparadox.docrag.query;

import eu.virtualparadox.docrag.rag.retriever.model.RetrievalResult;

/**
 * @param question the question as asked
 * @param answer   generated answer
 * @param context  segments the answer was grounded on
 */
public record QueryAnswer(String question, String answer, RetrievalResult context) {
}
