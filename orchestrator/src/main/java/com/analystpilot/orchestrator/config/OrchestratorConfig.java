package com.analystpilot.orchestrator.config;

import com.analystpilot.orchestrator.agent.FeedbackOrchestrator;
import com.analystpilot.orchestrator.agent.PromptBuilder;
import com.analystpilot.orchestrator.agent.ResponseParser;
import com.analystpilot.orchestrator.cache.CacheKeys;
import com.analystpilot.orchestrator.cache.FileResponseCache;
import com.analystpilot.orchestrator.cache.ResponseCache;
import com.analystpilot.orchestrator.executor.ContainerRuntime;
import com.analystpilot.orchestrator.executor.DockerContainerRuntime;
import com.analystpilot.orchestrator.executor.ImportScanner;
import com.analystpilot.orchestrator.executor.SandboxExecutor;
import com.analystpilot.orchestrator.provider.AnthropicTransport;
import com.analystpilot.orchestrator.provider.BackoffPolicy;
import com.analystpilot.orchestrator.provider.CircuitBreaker;
import com.analystpilot.orchestrator.provider.GeminiTransport;
import com.analystpilot.orchestrator.provider.HttpLlmTransport;
import com.analystpilot.orchestrator.provider.LlmTransport;
import com.analystpilot.orchestrator.provider.OpenAiCompatibleTransport;
import com.analystpilot.orchestrator.provider.ProviderClient;
import com.analystpilot.orchestrator.provider.ProviderConfig;
import com.analystpilot.orchestrator.provider.ProviderKind;
import com.analystpilot.orchestrator.provider.ResilientProviderClient;
import com.analystpilot.orchestrator.provider.Sleeper;
import com.analystpilot.orchestrator.service.UploadStager;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.core.DefaultDockerClientConfig;
import com.github.dockerjava.core.DockerClientImpl;
import com.github.dockerjava.zerodep.ZerodepDockerHttpClient;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the orchestration engine from {@link AnalystProperties}.
 *
 * Components are plain classes constructed here rather than annotated
 * beans, so each one can be built directly in unit tests with fakes.
 */
@Configuration
@EnableConfigurationProperties(AnalystProperties.class)
public class OrchestratorConfig {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorConfig.class);

    /** Drives breaker cooldowns and attempt deadlines. */
    @Bean
    Clock clock() {
        return new MonotonicClock();
    }

    // ------------------------------------------------------------------
    // Providers
    // ------------------------------------------------------------------

    /** Workers that run provider calls so each one can be cancelled on timeout. */
    @Bean(destroyMethod = "shutdownNow")
    ExecutorService providerCallPool(AnalystProperties props) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(props.getLlm().getWorkerThreads(), runnable -> {
            Thread t = new Thread(runnable, "provider-call-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    HttpClient providerHttpClient() {
        return HttpLlmTransport.defaultHttpClient();
    }

    @Bean
    ResponseCache responseCache(AnalystProperties props, ObjectMapper objectMapper) {
        // Expiry is written to disk and read back after restarts, so it needs wall time.
        return new FileResponseCache(Path.of(props.getCache().getDir()), objectMapper, Clock.systemUTC(),
                Duration.ofSeconds(props.getCache().getDefaultTtlSeconds()));
    }

    @Bean
    CacheKeys cacheKeys(ObjectMapper objectMapper) {
        return new CacheKeys(objectMapper);
    }

    /**
     * One resilient client per configured provider, in configured order.
     * Providers that are disabled or have no API key are left out with a warning.
     */
    @Bean
    List<ProviderClient> providerClients(AnalystProperties props,
                                         HttpClient providerHttpClient,
                                         ObjectMapper objectMapper,
                                         ResponseCache responseCache,
                                         CacheKeys cacheKeys,
                                         ExecutorService providerCallPool,
                                         Clock clock,
                                         MeterRegistry meterRegistry) {
        Map<ProviderKind, LlmTransport> transports = new EnumMap<>(ProviderKind.class);
        for (LlmTransport transport : List.of(
                new OpenAiCompatibleTransport(providerHttpClient, objectMapper),
                new GeminiTransport(providerHttpClient, objectMapper),
                new AnthropicTransport(providerHttpClient, objectMapper))) {
            transports.put(transport.kind(), transport);
        }

        AnalystProperties.Llm llm = props.getLlm();
        Duration timeout     = Duration.ofSeconds(llm.getPerCallTimeoutSeconds());
        Duration backoffBase = seconds(llm.getBackoffBaseSeconds());
        Duration backoffCap  = seconds(llm.getBackoffCapSeconds());
        int responseTtl      = props.getCache().getResponseTtlSeconds();
        Duration cacheTtl    = responseTtl > 0 ? Duration.ofSeconds(responseTtl) : null;

        List<ProviderClient> clients = new ArrayList<>();
        for (AnalystProperties.Provider p : props.getProviders()) {
            if (!p.isEnabled()) {
                log.info("Provider '{}' disabled; skipping", p.getName());
                continue;
            }
            if (p.getApiKey() == null || p.getApiKey().isBlank()) {
                log.warn("Provider '{}' has no API key configured; skipping", p.getName());
                continue;
            }
            LlmTransport transport = transports.get(p.getKind());
            if (transport == null) {
                throw new IllegalStateException("No transport for provider kind " + p.getKind());
            }
            ProviderConfig config = new ProviderConfig(p.getName(), p.getKind(), p.getBaseUrl(),
                    p.getModel(), p.getApiKey(), timeout, llm.getMaxRetries(), backoffBase);
            clients.add(new ResilientProviderClient(
                    config,
                    transport,
                    new CircuitBreaker(p.getName(), llm.getBreakerThreshold(),
                            Duration.ofSeconds(llm.getBreakerCooldownSeconds()), clock),
                    responseCache,
                    cacheKeys,
                    cacheTtl,
                    new BackoffPolicy(backoffBase, backoffCap, llm.getBackoffJitter(), new Random()),
                    Sleeper.SYSTEM,
                    providerCallPool,
                    meterRegistry));
            log.info("Provider '{}' enabled ({}, model {})", p.getName(), p.getKind(), p.getModel());
        }
        if (clients.isEmpty()) {
            log.warn("No LLM providers available; every analysis request will fail");
        }
        return clients;
    }

    // ------------------------------------------------------------------
    // Sandbox
    // ------------------------------------------------------------------

    @Bean
    DockerClient dockerClient(AnalystProperties props) {
        // Zerodep transport speaks to the unix socket without extra native libraries.
        var config = DefaultDockerClientConfig.createDefaultConfigBuilder()
                .withDockerHost(props.getSandbox().getDockerHost())
                .build();
        var httpClient = new ZerodepDockerHttpClient.Builder()
                .dockerHost(config.getDockerHost())
                .sslConfig(config.getSSLConfig())
                .build();
        return DockerClientImpl.getInstance(config, httpClient);
    }

    @Bean
    ContainerRuntime containerRuntime(DockerClient dockerClient, AnalystProperties props) {
        return new DockerContainerRuntime(dockerClient,
                Duration.ofSeconds(props.getSandbox().getPullTimeoutSeconds()));
    }

    @Bean
    ImportScanner importScanner() {
        return ImportScanner.withBundledStdlib();
    }

    @Bean(destroyMethod = "shutdown")
    SandboxExecutor sandboxExecutor(AnalystProperties props,
                                    ContainerRuntime containerRuntime,
                                    ImportScanner importScanner,
                                    MeterRegistry meterRegistry) {
        AnalystProperties.Sandbox sandbox = props.getSandbox();
        return new SandboxExecutor(
                containerRuntime,
                importScanner,
                Path.of(sandbox.getWorkspaceRoot()),
                sandbox.getImage(),
                Duration.ofSeconds(sandbox.getExecutionTimeoutSeconds()),
                Duration.ofSeconds(sandbox.getInstallTimeoutSeconds()),
                meterRegistry);
    }

    // ------------------------------------------------------------------
    // Feedback loop
    // ------------------------------------------------------------------

    @Bean
    ResponseParser responseParser(ObjectMapper objectMapper) {
        return new ResponseParser(objectMapper);
    }

    @Bean
    PromptBuilder promptBuilder() {
        return new PromptBuilder();
    }

    @Bean
    FeedbackOrchestrator feedbackOrchestrator(AnalystProperties props,
                                              List<ProviderClient> providerClients,
                                              ResponseParser responseParser,
                                              SandboxExecutor sandboxExecutor,
                                              PromptBuilder promptBuilder,
                                              Clock clock,
                                              MeterRegistry meterRegistry) {
        AnalystProperties.Feedback feedback = props.getFeedback();
        return new FeedbackOrchestrator(
                providerClients,
                responseParser,
                sandboxExecutor,
                promptBuilder,
                new FeedbackOrchestrator.Settings(
                        feedback.getMaxIterations(),
                        Duration.ofSeconds(feedback.getAttemptBudgetSeconds()),
                        feedback.isKeepSessionOpen()),
                clock,
                meterRegistry);
    }

    @Bean
    UploadStager uploadStager(AnalystProperties props) {
        return new UploadStager(Path.of(System.getProperty("java.io.tmpdir")),
                props.getUpload().getMaxFileSizeMb() * 1024L * 1024L);
    }

    private static Duration seconds(double value) {
        return Duration.ofMillis(Math.round(value * 1000));
    }
}
