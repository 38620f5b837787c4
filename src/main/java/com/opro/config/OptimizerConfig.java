package com.opro.config;

import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.google.genai.GoogleGenAiChatModel;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class OptimizerConfig {

    @Bean
    @Primary
    public ChatClient chatClient(GoogleGenAiChatModel googleGenAiChatModel) {
        return ChatClient.builder(googleGenAiChatModel).build();
    }

    @Bean
    public ChatClient openAiChatClient(ObjectProvider<OpenAiChatModel> openAiChatModelProvider) {
        return openAiChatModelProvider.getIfAvailable() != null
                ? ChatClient.builder(openAiChatModelProvider.getIfAvailable()).build()
                : null;
    }

    /**
     * Per-question grading calls. Unbounded: fan-out is limited by the size of the question set.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService graderExecutor() {
        return Executors.newCachedThreadPool();
    }

    /**
     * Bounds how many candidates are scored at the same time.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService scoringExecutor(OproProperties properties) {
        return Executors.newFixedThreadPool(Math.max(1, properties.getScoring().getBatchConcurrency()));
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService autoRunExecutor() {
        return Executors.newCachedThreadPool();
    }
}
