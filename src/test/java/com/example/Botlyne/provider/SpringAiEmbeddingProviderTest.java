package com.example.Botlyne.provider;

import com.example.Botlyne.exception.PermanentDependencyException;
import org.junit.jupiter.api.Test;
import org.springframework.ai.embedding.EmbeddingModel;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SpringAiEmbeddingProviderTest {

    private final EmbeddingModel embeddingModel = mock(EmbeddingModel.class);
    private final SpringAiEmbeddingProvider provider = new SpringAiEmbeddingProvider(embeddingModel);

    @Test
    void returnsTheModelVector() {
        when(embeddingModel.embed("refund policy")).thenReturn(new float[]{0.1f, 0.2f});

        assertThat(provider.embed("refund policy")).containsExactly(0.1f, 0.2f);
    }

    @Test
    void emptyVectorIsAPermanentFailure() {
        when(embeddingModel.embed("refund policy")).thenReturn(new float[0]);

        assertThatThrownBy(() -> provider.embed("refund policy"))
                .isInstanceOf(PermanentDependencyException.class);
    }
}
