package eu.virtualparadox.docrag.rag.retriever.service;

import eu.virtualparadox.docrag.rag.index.IndexHandle;
import eu.virtualparadox.docrag.rag.retriever.model.RetrievalResult;

import java.util.Set;

public interface RetrieverService {

    RetrievalResult search(final IndexHandle handle, final String query, final int k, final Set<String> columns);

}
