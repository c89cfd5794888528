package com.example.Botlyne;

import com.example.Botlyne.provider.ChatClientGenerationProvider;
import com.example.Botlyne.provider.GenerationProvider;
import com.example.Botlyne.resilience.DependencyGuardRegistry;
import com.example.Botlyne.resilience.DependencyHealth;
import com.example.Botlyne.tools.CalculatorToolDefinition;
import com.example.Botlyne.tools.ToolProfile;
import com.example.Botlyne.tools.ToolRegistry;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
@Import(BotlyneApplicationTests.TestAiConfiguration.class)
class BotlyneApplicationTests {

    @Autowired
    private DependencyGuardRegistry guards;

    @Autowired
    private ToolRegistry toolRegistry;

    @Autowired
    @Qualifier("primaryGenerationProvider")
    private GenerationProvider primaryProvider;

    @Autowired
    @Qualifier("reviewGenerationProvider")
    private GenerationProvider reviewProvider;

    @Test
    void contextLoads() {
        assertThat(guards.snapshot())
                .extracting(s -> s.dependency())
                .containsExactly("embedding", "vector-store", "generation");
        assertThat(guards.health().status()).isEqualTo(DependencyHealth.HEALTHY);
        assertThat(toolRegistry.getFunctionBeanNamesForProfile(ToolProfile.ASSISTANT))
                .containsExactly(CalculatorToolDefinition.NAME);
        assertThat(toolRegistry.getFunctionBeanNamesForProfile(ToolProfile.NONE)).isEmpty();
    }

    @Test
    void bothAgentsShareOneProviderImplementation() {
        assertThat(primaryProvider).isInstanceOfSatisfying(ChatClientGenerationProvider.class,
                p -> assertThat(p.role()).isEqualTo(ChatClientGenerationProvider.Role.PRIMARY));
        assertThat(reviewProvider).isInstanceOfSatisfying(ChatClientGenerationProvider.class,
                p -> assertThat(p.role()).isEqualTo(ChatClientGenerationProvider.Role.REVIEWER));
    }

    @TestConfiguration
    static class TestAiConfiguration {
        @Bean
        EmbeddingModel embeddingModel() {
            return Mockito.mock(EmbeddingModel.class);
        }

        @Bean
        OpenAiChatModel openAiChatModel() {
            return Mockito.mock(OpenAiChatModel.class);
        }
    }
}
