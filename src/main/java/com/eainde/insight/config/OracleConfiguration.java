package com.eainde.insight.config;

import com.eainde.insight.analysis.NarrativeWriter;
import com.eainde.insight.oracle.ChatModelCompletionClient;
import com.eainde.insight.oracle.CompletionClient;
import com.eainde.insight.oracle.LoggingChatModelListener;
import com.eainde.insight.oracle.SchemaOracle;
import com.eainde.insight.oracle.UsageTracker;
import com.eainde.insight.schema.SchemaCache;
import com.eainde.insight.thread.MdcAwareExecutor;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Wires the LLM proxy client and the two oracle-backed components: schema discovery and
 * narrative generation.
 *
 * <p>The proxy speaks the OpenAI chat-completions protocol, so the OpenAI langchain4j model is
 * pointed at it. Without a base URL or key the client is built unconfigured and every caller
 * falls back to its deterministic path.
 */
@Slf4j
@Configuration
public class OracleConfiguration {

    public static final String ORACLE_CALL_EXECUTOR = "oracleCallExecutor";

    @Bean
    public UsageTracker usageTracker() {
        return new UsageTracker();
    }

    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper();
    }

    @Bean(name = ORACLE_CALL_EXECUTOR, destroyMethod = "shutdownNow")
    public ExecutorService oracleCallExecutor() {
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("oracle-call-");
        threadFactory.setDaemon(true);
        return Executors.newCachedThreadPool(threadFactory);
    }

    @Bean
    public CompletionClient completionClient(InsightProperties properties,
                                             @Qualifier(ORACLE_CALL_EXECUTOR) ExecutorService oracleCallExecutor,
                                             UsageTracker usageTracker) {
        InsightProperties.Oracle oracle = properties.getOracle();
        if (!oracle.isConfigured()) {
            log.warn("LLM proxy not configured; schema discovery and narratives use fallbacks only");
            return ChatModelCompletionClient.unconfigured(usageTracker);
        }

        OpenAiChatModel chatModel = OpenAiChatModel.builder()
                .baseUrl(oracle.getBaseUrl())
                .apiKey(oracle.getApiKey())
                .modelName(oracle.getModelName())
                .timeout(oracle.getTimeout())
                .maxRetries(oracle.getMaxRetries())
                .logRequests(oracle.isLogRequests())
                .logResponses(oracle.isLogRequests())
                .listeners(List.of(new LoggingChatModelListener()))
                .build();

        log.info("LLM proxy client ready: model={}, baseUrl={}", oracle.getModelName(), oracle.getBaseUrl());
        return new ChatModelCompletionClient(chatModel, new MdcAwareExecutor(oracleCallExecutor), usageTracker);
    }

    @Bean
    public SchemaCache schemaCache() {
        return new SchemaCache();
    }

    @Bean
    public SchemaOracle schemaOracle(CompletionClient completionClient, ObjectMapper objectMapper,
                                     InsightProperties properties) {
        InsightProperties.Oracle oracle = properties.getOracle();
        return new SchemaOracle(completionClient, objectMapper, oracle.getTimeout(), oracle.getSchemaMaxTokens());
    }

    @Bean
    public NarrativeWriter narrativeWriter(CompletionClient completionClient, ObjectMapper objectMapper,
                                           InsightProperties properties) {
        InsightProperties.Oracle oracle = properties.getOracle();
        return new NarrativeWriter(completionClient, objectMapper, oracle.getTimeout(), oracle.getNarrativeMaxTokens());
    }
}
