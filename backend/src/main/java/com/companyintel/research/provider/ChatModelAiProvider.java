package com.companyintel.research.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.AuthenticationException;
import dev.langchain4j.exception.InternalServerException;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.exception.TimeoutException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.TokenUsage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public class ChatModelAiProvider implements AiProvider {
    private static final Logger log = LoggerFactory.getLogger(ChatModelAiProvider.class);

    private final String name;
    private final ChatModel chatModel;
    private final ProviderMetadata metadata;
    private final ObjectMapper objectMapper;

    public ChatModelAiProvider(String name, ChatModel chatModel, ProviderMetadata metadata, ObjectMapper objectMapper) {
        this.name = name;
        this.chatModel = chatModel;
        this.metadata = metadata;
        this.objectMapper = objectMapper;
    }

    @Override
    public String providerName() {
        return name;
    }

    @Override
    public ProviderMetadata metadata() {
        return metadata;
    }

    @Override
    public PageSelectionResponse selectPages(PageSelectionRequest request) {
        ChatResponse response = chat(PromptTemplates.PAGE_SELECTION_SYSTEM, PromptTemplates.pageSelection(request));
        String text = response.aiMessage() == null ? null : response.aiMessage().text();
        return new PageSelectionResponse(parseSelections(text), usageOf(response));
    }

    @Override
    public SynthesisResponse synthesize(SynthesisRequest request) {
        String prompt = request.isRepair()
            ? PromptTemplates.synthesisRepair(request)
            : PromptTemplates.synthesis(request);
        ChatResponse response = chat(PromptTemplates.SYNTHESIS_SYSTEM, prompt);
        String text = response.aiMessage() == null ? "" : response.aiMessage().text();
        return new SynthesisResponse(text == null ? "" : text, usageOf(response));
    }

    List<SelectedPage> parseSelections(String text) {
        if (text == null || text.isBlank()) {
            throw new ProviderException(name, ProviderFailureKind.MALFORMED_RESPONSE, "Empty page selection response");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(JsonResponses.extractJson(text));
        } catch (JsonProcessingException e) {
            throw new ProviderException(
                name,
                ProviderFailureKind.MALFORMED_RESPONSE,
                "Page selection response is not JSON: " + e.getOriginalMessage(),
                e
            );
        }
        JsonNode items = root;
        if (root != null && root.isObject()) {
            for (String field : List.of("pages", "urls", "selected_pages", "selections")) {
                if (root.path(field).isArray()) {
                    items = root.path(field);
                    break;
                }
            }
        }
        if (items == null || !items.isArray()) {
            throw new ProviderException(name, ProviderFailureKind.MALFORMED_RESPONSE, "Page selection response is not a list");
        }
        List<SelectedPage> selections = new ArrayList<>();
        for (JsonNode item : items) {
            if (item.isTextual()) {
                selections.add(new SelectedPage(item.asText(), null));
            } else if (item.isObject() && item.path("url").isTextual()) {
                String rationale = item.path("reason").asText(item.path("rationale").asText(null));
                selections.add(new SelectedPage(item.path("url").asText(), rationale));
            }
        }
        return selections;
    }

    private ChatResponse chat(String system, String user) {
        ChatRequest request = ChatRequest.builder()
            .messages(SystemMessage.from(system), UserMessage.from(user))
            .build();
        try {
            return chatModel.chat(request);
        } catch (RuntimeException e) {
            ProviderException failure = classify(name, e);
            log.debug("provider call failed provider={} kind={} error={}", name, failure.getKind(), e.toString());
            throw failure;
        }
    }

    private ProviderUsage usageOf(ChatResponse response) {
        TokenUsage usage = response.tokenUsage();
        if (usage == null) {
            return ProviderUsage.none();
        }
        return new ProviderUsage(
            usage.inputTokenCount() == null ? 0 : usage.inputTokenCount(),
            usage.outputTokenCount() == null ? 0 : usage.outputTokenCount()
        );
    }

    static ProviderException classify(String providerName, RuntimeException e) {
        if (e instanceof ProviderException providerException) {
            return providerException;
        }
        if (e instanceof RateLimitException) {
            return new ProviderException(providerName, ProviderFailureKind.QUOTA_EXCEEDED, e.getMessage(), e);
        }
        if (e instanceof InternalServerException || e instanceof TimeoutException) {
            return new ProviderException(providerName, ProviderFailureKind.TRANSIENT, e.getMessage(), e);
        }
        if (e instanceof AuthenticationException) {
            return new ProviderException(providerName, ProviderFailureKind.REJECTED, e.getMessage(), e);
        }
        String message = e.getMessage() == null ? "" : e.getMessage().toLowerCase(Locale.ROOT);
        if (message.contains("429") || message.contains("quota") || message.contains("rate limit")) {
            return new ProviderException(providerName, ProviderFailureKind.QUOTA_EXCEEDED, e.getMessage(), e);
        }
        if (message.matches("(?s).*\\b5\\d\\d\\b.*") || message.contains("timed out") || message.contains("unavailable")) {
            return new ProviderException(providerName, ProviderFailureKind.TRANSIENT, e.getMessage(), e);
        }
        if (message.matches("(?s).*\\b4\\d\\d\\b.*")) {
            return new ProviderException(providerName, ProviderFailureKind.REJECTED, e.getMessage(), e);
        }
        return new ProviderException(providerName, ProviderFailureKind.UNEXPECTED, e.toString(), e);
    }
}
