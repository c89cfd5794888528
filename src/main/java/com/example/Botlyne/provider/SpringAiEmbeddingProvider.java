package com.example.Botlyne.provider;

import com.example.Botlyne.exception.PermanentDependencyException;
import lombok.RequiredArgsConstructor;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class SpringAiEmbeddingProvider implements EmbeddingProvider {

    private final EmbeddingModel embeddingModel;

    @Override
    public float[] embed(String text) {
        float[] vector = embeddingModel.embed(text);
        if (vector == null || vector.length == 0) {
            throw new PermanentDependencyException("Embedding model returned an empty vector");
        }
        return vector;
    }
}
