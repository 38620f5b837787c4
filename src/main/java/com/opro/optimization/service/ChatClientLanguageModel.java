package com.opro.optimization.service;

import com.opro.config.OproProperties;
import com.opro.optimization.api.LanguageModelClient;
import com.opro.optimization.model.ModelCompletion;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.metadata.Usage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * {@link LanguageModelClient} backed by Spring AI. The provider comes from {@code opro.ai-provider};
 * model and temperature are set per call.
 */
@Service
@Slf4j
public class ChatClientLanguageModel implements LanguageModelClient {

    private final ChatClient chatClient;
    private final ChatClient openAiChatClient;
    private final OproProperties properties;

    public ChatClientLanguageModel(ChatClient chatClient,
                                   @Qualifier("openAiChatClient") ObjectProvider<ChatClient> openAiChatClientProvider,
                                   OproProperties properties) {
        this.chatClient = chatClient;
        this.openAiChatClient = openAiChatClientProvider.getIfAvailable();
        this.properties = properties;
    }

    @Override
    public ModelCompletion complete(String prompt, String model, double temperature) {
        ChatResponse response = getChatRequestSpec(model, temperature)
                .user(prompt)
                .call()
                .chatResponse();
        return toCompletion(response);
    }

    private ChatClient.ChatClientRequestSpec getChatRequestSpec(String model, double temperature) {
        if (properties.getAiProvider() == OproProperties.AiProvider.OPENAI) {
            if (openAiChatClient == null) {
                throw new IllegalStateException("OpenAI provider is not properly configured. "
                        + "Check that you have a valid API key or a custom Base URL in your configuration.");
            }
            String activeModel = StringUtils.hasText(model) ? model : properties.getOpenai().getModel();
            return openAiChatClient.prompt()
                    .options(OpenAiChatOptions.builder().model(activeModel).temperature(temperature).build());
        }
        return chatClient.prompt()
                .options(ChatOptions.builder().model(model).temperature(temperature).build());
    }

    private static ModelCompletion toCompletion(@Nullable ChatResponse response) {
        if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
            return new ModelCompletion("", 0, 0);
        }
        String text = response.getResult().getOutput().getText();
        Usage usage = response.getMetadata() != null ? response.getMetadata().getUsage() : null;
        long promptTokens = usage != null && usage.getPromptTokens() != null ? usage.getPromptTokens() : 0;
        long completionTokens = usage != null && usage.getCompletionTokens() != null ? usage.getCompletionTokens() : 0;
        return new ModelCompletion(text == null ? "" : text, promptTokens, completionTokens);
    }
}
