package com.example.safespace.config;

import com.example.safespace.generation.GenerationClient;
import com.example.safespace.generation.LangChain4jGenerationClient;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

@Slf4j
@Configuration
@EnableConfigurationProperties(Langchain4jOpenAiProperties.class)
public class Langchain4jConfig {

    @Bean
    public GenerationClient generationClient(Langchain4jOpenAiProperties props, PromptProperties prompts) {
        // no key: start anyway with an unconfigured client
        if (!props.hasApiKey()) {
            log.warn("langchain4j.openai.api-key not configured. Chat replies will use the fallback message "
                    + "and report narratives cannot be generated. Set OPENAI_API_KEY to enable generation.");
            return new LangChain4jGenerationClient(null, null, prompts);
        }
        ChatModel replyModel = chatModel(props, props.getChatModel(), props.getTemperature());
        ChatModel reportModel = chatModel(props, props.getReportModel(), props.getReportTemperature());
        return new LangChain4jGenerationClient(replyModel, reportModel, prompts);
    }

    private static ChatModel chatModel(Langchain4jOpenAiProperties props, String modelName, double temperature) {
        return OpenAiChatModel.builder()
                .apiKey(props.getApiKey())
                .baseUrl(StringUtils.hasText(props.getBaseUrl()) ? props.getBaseUrl() : null)
                .modelName(modelName)
                .temperature(temperature)
                .maxTokens(props.getMaxOutputTokens())
                .timeout(props.getTimeout())
                // retries are owned by RetryExecutor
                .maxRetries(0)
                .build();
    }
}
