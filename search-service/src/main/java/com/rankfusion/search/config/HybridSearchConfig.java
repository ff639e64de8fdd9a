package com.rankfusion.search.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rankfusion.search.service.HybridSearchOrchestrator;
import com.rankfusion.search.service.OpenAiQueryEmbedder;
import com.rankfusion.search.service.QueryEmbedder;
import com.rankfusion.search.service.RankFuser;
import com.rankfusion.search.service.ResultAssembler;
import com.rankfusion.search.service.TextRetriever;
import com.rankfusion.search.service.VectorRetriever;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class HybridSearchConfig {
    private static final Logger log = LoggerFactory.getLogger(HybridSearchConfig.class);

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService retrievalExecutor() {
        return Executors.newCachedThreadPool(new CustomizableThreadFactory("retrieval-"));
    }

    @Bean
    @ConditionalOnProperty(prefix = "embedding.openai", name = "enabled", havingValue = "true")
    public QueryEmbedder queryEmbedder(
            @Value("${embedding.openai.base-url:https://api.openai.com}") String baseUrl,
            @Value("${embedding.openai.api-key}") String apiKey,
            @Value("${embedding.openai.model:" + OpenAiQueryEmbedder.DEFAULT_MODEL + "}") String model,
            @Value("${embedding.openai.timeout-ms:2000}") long timeoutMs,
            ObjectMapper objectMapper
    ) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalStateException("embedding.openai.api-key must be set when embedding.openai.enabled=true");
        }
        log.info("query embedding enabled base_url={} model={}", baseUrl, model);
        return new OpenAiQueryEmbedder(baseUrl, apiKey, model, timeoutMs, objectMapper);
    }

    @Bean
    public HybridSearchOrchestrator hybridSearchOrchestrator(
            VectorRetriever vectorRetriever,
            TextRetriever textRetriever,
            ObjectProvider<QueryEmbedder> queryEmbedder,
            RankFuser rankFuser,
            ResultAssembler resultAssembler,
            ExecutorService retrievalExecutor,
            ObjectProvider<MeterRegistry> meterRegistry,
            @Value("${search.retrieval.vector-timeout-ms:1000}") long vectorTimeoutMs,
            @Value("${search.retrieval.text-timeout-ms:1000}") long textTimeoutMs
    ) {
        return new HybridSearchOrchestrator(
                vectorRetriever,
                textRetriever,
                queryEmbedder.getIfAvailable(),
                rankFuser,
                resultAssembler,
                retrievalExecutor,
                meterRegistry.getIfAvailable(),
                Duration.ofMillis(vectorTimeoutMs),
                Duration.ofMillis(textTimeoutMs)
        );
    }
}
