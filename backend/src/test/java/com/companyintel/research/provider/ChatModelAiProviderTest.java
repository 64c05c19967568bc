package com.companyintel.research.provider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.TokenUsage;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ChatModelAiProviderTest {
    private static final ProviderMetadata METADATA =
        new ProviderMetadata("gpt-4o-mini", 400_000, 0.15, 0.60, Duration.ofSeconds(3));

    @Mock
    private ChatModel chatModel;

    @Test
    void selectPagesReadsFencedJsonAndUsage() {
        when(chatModel.chat(any(ChatRequest.class))).thenReturn(ChatResponse.builder()
            .aiMessage(AiMessage.from("""
                Here are the pages:
                ```json
                {"pages": [{"url": "https://acme.example/about", "reason": "company overview"}, "/contact"]}
                ```
                """))
            .tokenUsage(new TokenUsage(1200, 80))
            .build());

        PageSelectionResponse response = provider().selectPages(new PageSelectionRequest(
            "Acme",
            "https://acme.example/",
            List.of("https://acme.example/about", "https://acme.example/contact"),
            2,
            5
        ));

        assertThat(response.selections()).containsExactly(
            new SelectedPage("https://acme.example/about", "company overview"),
            new SelectedPage("/contact", null)
        );
        assertEquals(1200, response.usage().inputTokens());
        assertEquals(80, response.usage().outputTokens());
    }

    @Test
    void proseAnswerIsMalformed() {
        ProviderException failure = assertThrows(
            ProviderException.class,
            () -> provider().parseSelections("I would read the about page first.")
        );
        assertEquals(ProviderFailureKind.MALFORMED_RESPONSE, failure.getKind());
    }

    @Test
    void rateLimitFromModelIsQuotaExceeded() {
        when(chatModel.chat(any(ChatRequest.class))).thenThrow(new RateLimitException("429 Too Many Requests"));

        ProviderException failure = assertThrows(
            ProviderException.class,
            () -> provider().synthesize(SynthesisRequest.initial("Acme", "https://acme.example/", "text", 1))
        );
        assertEquals(ProviderFailureKind.QUOTA_EXCEEDED, failure.getKind());
        assertEquals("openai", failure.getProviderName());
    }

    @Test
    void classifiesUntypedFailuresByMessage() {
        assertEquals(
            ProviderFailureKind.QUOTA_EXCEEDED,
            ChatModelAiProvider.classify("gemini", new IllegalStateException("You exceeded your current quota")).getKind()
        );
        assertEquals(
            ProviderFailureKind.TRANSIENT,
            ChatModelAiProvider.classify("gemini", new IllegalStateException("status 503 from upstream")).getKind()
        );
        assertEquals(
            ProviderFailureKind.REJECTED,
            ChatModelAiProvider.classify("gemini", new IllegalStateException("status 400 bad request")).getKind()
        );
        assertEquals(
            ProviderFailureKind.UNEXPECTED,
            ChatModelAiProvider.classify("gemini", new IllegalStateException("something odd")).getKind()
        );
    }

    @Test
    void stripsFencesAndSurroundingProse() {
        assertEquals("[1, 2]", JsonResponses.extractJson("```\n[1, 2]\n```"));
        assertEquals("{\"a\": {\"b\": 1}}", JsonResponses.extractJson("Result: {\"a\": {\"b\": 1}} done."));
        assertEquals("no json here", JsonResponses.extractJson("no json here"));
    }

    private ChatModelAiProvider provider() {
        return new ChatModelAiProvider("openai", chatModel, METADATA, new ObjectMapper());
    }
}
