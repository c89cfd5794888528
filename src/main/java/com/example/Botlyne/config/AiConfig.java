package com.example.Botlyne.config;

import com.example.Botlyne.provider.ChatClientGenerationProvider;
import com.example.Botlyne.provider.GenerationProvider;
import com.example.Botlyne.tools.ToolRegistry;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.deepseek.DeepSeekChatModel;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AiConfig {

    /**
     * DeepSeek when available, otherwise OpenAI. Whichever key is configured decides the vendor.
     */
    @Bean
    public ChatClient chatClient(
            ObjectProvider<DeepSeekChatModel> deepSeekProvider,
            ObjectProvider<OpenAiChatModel> openAiProvider
    ) {
        DeepSeekChatModel deepseekModel = deepSeekProvider.getIfAvailable();
        if (deepseekModel != null) {
            return ChatClient.builder(deepseekModel).build();
        }

        OpenAiChatModel openAiModel = openAiProvider.getIfAvailable();
        if (openAiModel != null) {
            return ChatClient.builder(openAiModel).build();
        }

        throw new IllegalStateException("No ChatModel beans are available to build a ChatClient");
    }

    @Bean
    @Qualifier("primaryGenerationProvider")
    public GenerationProvider primaryGenerationProvider(ChatClient chatClient, ToolRegistry toolRegistry) {
        return new ChatClientGenerationProvider(chatClient, toolRegistry, ChatClientGenerationProvider.Role.PRIMARY);
    }

    @Bean
    @Qualifier("reviewGenerationProvider")
    public GenerationProvider reviewGenerationProvider(ChatClient chatClient, ToolRegistry toolRegistry) {
        return new ChatClientGenerationProvider(chatClient, toolRegistry, ChatClientGenerationProvider.Role.REVIEWER);
    }
}
