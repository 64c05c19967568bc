package com.companyintel.config;

import com.companyintel.research.provider.AiProvider;
import com.companyintel.research.provider.ChatModelAiProvider;
import com.companyintel.research.provider.ProviderMetadata;
import com.companyintel.research.provider.ProviderRegistry;
import com.companyintel.research.provider.TokenBucketRateLimiter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dev.langchain4j.model.openai.OpenAiChatModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class ResearchConfig {
    private static final Logger log = LoggerFactory.getLogger(ResearchConfig.class);

    @Bean(name = "httpExecutor", destroyMethod = "shutdown")
    public ExecutorService httpExecutor(ResearchProperties properties) {
        int size = Math.max(4, properties.getGlobalConcurrency() * 2);
        return Executors.newFixedThreadPool(size);
    }

    // page workers block on their own fetch tasks, so this pool must not be bounded
    @Bean(name = "extractionExecutor", destroyMethod = "shutdownNow")
    public ExecutorService extractionExecutor() {
        return Executors.newCachedThreadPool();
    }

    @Bean(name = "researchRunExecutor", destroyMethod = "shutdown")
    public ExecutorService researchRunExecutor(ResearchProperties properties) {
        return Executors.newFixedThreadPool(Math.max(1, properties.getMaxConcurrentRuns()));
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Bean
    public TokenBucketRateLimiter providerRateLimiter(ResearchProperties properties) {
        ResearchProperties.RateLimit rateLimit = properties.getRateLimit();
        return new TokenBucketRateLimiter(
            rateLimit.getPermitsPerSecond(),
            rateLimit.getBurst(),
            Duration.ofSeconds(rateLimit.getMaxWaitSeconds())
        );
    }

    @Bean
    public ProviderRegistry providerRegistry(ResearchProperties properties, ObjectMapper objectMapper) {
        List<AiProvider> providers = new ArrayList<>();
        for (Map.Entry<String, ResearchProperties.Definition> entry : properties.getProviders().getDefinitions().entrySet()) {
            String name = entry.getKey();
            ResearchProperties.Definition definition = entry.getValue();
            if (definition == null || !definition.isConfigured()) {
                log.warn("Skipping provider {}: api key or model missing", name);
                continue;
            }
            OpenAiChatModel.OpenAiChatModelBuilder builder = OpenAiChatModel.builder()
                .apiKey(definition.getApiKey())
                .modelName(definition.getModel())
                .temperature(definition.getTemperature())
                .timeout(Duration.ofSeconds(definition.getTimeoutSeconds()))
                .maxRetries(0);
            if (definition.getBaseUrl() != null && !definition.getBaseUrl().isBlank()) {
                builder.baseUrl(definition.getBaseUrl());
            }
            ProviderMetadata metadata = new ProviderMetadata(
                definition.getModel(),
                definition.getContextBudgetChars(),
                definition.getInputCostPerMillionTokens(),
                definition.getOutputCostPerMillionTokens(),
                Duration.ofMillis(definition.getTypicalLatencyMs())
            );
            providers.add(new ChatModelAiProvider(name, builder.build(), metadata, objectMapper));
            log.info("Registered provider {} model={} contextBudgetChars={}", name, definition.getModel(), metadata.contextBudgetChars());
        }
        if (providers.isEmpty()) {
            log.warn("No language-model providers configured; page selection will use the heuristic and synthesis will fail");
        }
        return new ProviderRegistry(providers);
    }
}
