package com.example.Botlyne.provider;

import com.example.Botlyne.model.RetrievedChunk;

import java.util.List;

/**
 * Nearest-neighbour search over chunk embeddings of one knowledge base.
 */
public interface VectorStore {

    List<RetrievedChunk> search(float[] vector, String kbId, int topK);
}
