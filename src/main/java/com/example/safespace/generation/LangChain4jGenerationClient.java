package com.example.safespace.generation;

import com.example.safespace.config.PromptProperties;
import com.example.safespace.model.IncidentDetails;
import com.example.safespace.model.Turn;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.List;

@Slf4j
public class LangChain4jGenerationClient implements GenerationClient {

    private final ChatModel replyModel;
    private final ChatModel reportModel;
    private final PromptProperties prompts;

    /**
     * @param replyModel  model for conversation replies, {@code null} when not configured
     * @param reportModel model for report narratives, {@code null} when not configured
     */
    public LangChain4jGenerationClient(ChatModel replyModel, ChatModel reportModel, PromptProperties prompts) {
        this.replyModel = replyModel;
        this.reportModel = reportModel;
        this.prompts = prompts;
    }

    @Override
    public boolean isConfigured() {
        return replyModel != null && reportModel != null;
    }

    @Override
    public Mono<String> generateReply(String message, List<Turn> history) {
        return Mono.fromCallable(() -> {
            ChatModel model = requireModel(replyModel);
            List<ChatMessage> messages = toMessages(prompts.getChatSystemPrompt(), history, message);
            return requireText(model.chat(messages), "reply");
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<String> generateNarrative(IncidentDetails details) {
        return Mono.fromCallable(() -> {
            ChatModel model = requireModel(reportModel);
            List<ChatMessage> messages = List.of(
                    SystemMessage.from(prompts.getReportSystemPrompt()),
                    UserMessage.from(ReportPrompts.userPrompt(details)));
            String narrative = requireText(model.chat(messages), "report narrative");
            log.info("Report narrative generated (length: {} chars)", narrative.length());
            return narrative;
        }).subscribeOn(Schedulers.boundedElastic());
    }

    static List<ChatMessage> toMessages(String systemPrompt, List<Turn> history, String message) {
        List<ChatMessage> messages = new ArrayList<>(history.size() + 2);
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            messages.add(SystemMessage.from(systemPrompt));
        }
        for (Turn turn : history) {
            messages.add(turn.isUser() ? UserMessage.from(turn.content()) : AiMessage.from(turn.content()));
        }
        messages.add(UserMessage.from(message));
        return messages;
    }

    private static ChatModel requireModel(ChatModel model) {
        if (model == null) {
            throw new GenerationNotConfiguredException();
        }
        return model;
    }

    private static String requireText(ChatResponse response, String what) {
        AiMessage aiMessage = response == null ? null : response.aiMessage();
        String text = aiMessage == null ? null : aiMessage.text();
        if (text == null || text.isBlank()) {
            throw new GenerationException("Generation API returned an empty " + what);
        }
        return text;
    }
}
