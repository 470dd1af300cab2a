package com.analystpilot.orchestrator.config;

import com.analystpilot.orchestrator.provider.ProviderKind;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * All runtime settings, bound from {@code application.yml} under the
 * {@code analyst} prefix. Every value there has an environment-variable
 * override, so deployments only need to export what differs from the defaults.
 */
@ConfigurationProperties(prefix = "analyst")
public class AnalystProperties {

    private List<Provider> providers = new ArrayList<>();
    private Llm      llm      = new Llm();
    private Feedback feedback = new Feedback();
    private Sandbox  sandbox  = new Sandbox();
    private Cache    cache    = new Cache();
    private Upload   upload   = new Upload();

    public List<Provider> getProviders() { return providers; }
    public void setProviders(List<Provider> providers) { this.providers = providers; }
    public Llm getLlm() { return llm; }
    public void setLlm(Llm llm) { this.llm = llm; }
    public Feedback getFeedback() { return feedback; }
    public void setFeedback(Feedback feedback) { this.feedback = feedback; }
    public Sandbox getSandbox() { return sandbox; }
    public void setSandbox(Sandbox sandbox) { this.sandbox = sandbox; }
    public Cache getCache() { return cache; }
    public void setCache(Cache cache) { this.cache = cache; }
    public Upload getUpload() { return upload; }
    public void setUpload(Upload upload) { this.upload = upload; }

    // ------------------------------------------------------------------
    // Nested groups
    // ------------------------------------------------------------------

    /** One entry per provider; list order is the fallback order. */
    public static class Provider {
        private String       name;
        private ProviderKind kind = ProviderKind.OPENAI_COMPATIBLE;
        private String       baseUrl;
        private String       model;
        private String       apiKey;
        private boolean      enabled = true;

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
        public ProviderKind getKind() { return kind; }
        public void setKind(ProviderKind kind) { this.kind = kind; }
        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }
        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }
        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }
        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }

    public static class Llm {
        private int    perCallTimeoutSeconds  = 30;
        private int    maxRetries             = 2;
        private double backoffBaseSeconds     = 1.0;
        private double backoffCapSeconds      = 8.0;
        private double backoffJitter          = 0.25;
        private int    breakerThreshold       = 3;
        private int    breakerCooldownSeconds = 120;
        private int    workerThreads          = 4;

        public int getPerCallTimeoutSeconds() { return perCallTimeoutSeconds; }
        public void setPerCallTimeoutSeconds(int v) { this.perCallTimeoutSeconds = v; }
        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int v) { this.maxRetries = v; }
        public double getBackoffBaseSeconds() { return backoffBaseSeconds; }
        public void setBackoffBaseSeconds(double v) { this.backoffBaseSeconds = v; }
        public double getBackoffCapSeconds() { return backoffCapSeconds; }
        public void setBackoffCapSeconds(double v) { this.backoffCapSeconds = v; }
        public double getBackoffJitter() { return backoffJitter; }
        public void setBackoffJitter(double v) { this.backoffJitter = v; }
        public int getBreakerThreshold() { return breakerThreshold; }
        public void setBreakerThreshold(int v) { this.breakerThreshold = v; }
        public int getBreakerCooldownSeconds() { return breakerCooldownSeconds; }
        public void setBreakerCooldownSeconds(int v) { this.breakerCooldownSeconds = v; }
        public int getWorkerThreads() { return workerThreads; }
        public void setWorkerThreads(int v) { this.workerThreads = v; }
    }

    public static class Feedback {
        private int     maxIterations        = 9;
        private int     attemptBudgetSeconds = 300;
        private boolean keepSessionOpen      = true;

        public int getMaxIterations() { return maxIterations; }
        public void setMaxIterations(int v) { this.maxIterations = v; }
        public int getAttemptBudgetSeconds() { return attemptBudgetSeconds; }
        public void setAttemptBudgetSeconds(int v) { this.attemptBudgetSeconds = v; }
        public boolean isKeepSessionOpen() { return keepSessionOpen; }
        public void setKeepSessionOpen(boolean v) { this.keepSessionOpen = v; }
    }

    public static class Sandbox {
        private String image                   = "python:3.11-slim";
        private int    executionTimeoutSeconds = 60;
        private int    installTimeoutSeconds   = 60;
        private int    pullTimeoutSeconds      = 300;
        private String workspaceRoot           = System.getProperty("java.io.tmpdir");
        private String dockerHost              = "unix:///var/run/docker.sock";

        public String getImage() { return image; }
        public void setImage(String image) { this.image = image; }
        public int getExecutionTimeoutSeconds() { return executionTimeoutSeconds; }
        public void setExecutionTimeoutSeconds(int v) { this.executionTimeoutSeconds = v; }
        public int getInstallTimeoutSeconds() { return installTimeoutSeconds; }
        public void setInstallTimeoutSeconds(int v) { this.installTimeoutSeconds = v; }
        public int getPullTimeoutSeconds() { return pullTimeoutSeconds; }
        public void setPullTimeoutSeconds(int v) { this.pullTimeoutSeconds = v; }
        public String getWorkspaceRoot() { return workspaceRoot; }
        public void setWorkspaceRoot(String workspaceRoot) { this.workspaceRoot = workspaceRoot; }
        public String getDockerHost() { return dockerHost; }
        public void setDockerHost(String dockerHost) { this.dockerHost = dockerHost; }
    }

    public static class Cache {
        private String dir                 = "/tmp/analyst_cache";
        private int    defaultTtlSeconds   = 3600;
        /** 0 or less falls back to {@code defaultTtlSeconds}. */
        private int    responseTtlSeconds  = 900;

        public String getDir() { return dir; }
        public void setDir(String dir) { this.dir = dir; }
        public int getDefaultTtlSeconds() { return defaultTtlSeconds; }
        public void setDefaultTtlSeconds(int v) { this.defaultTtlSeconds = v; }
        public int getResponseTtlSeconds() { return responseTtlSeconds; }
        public void setResponseTtlSeconds(int v) { this.responseTtlSeconds = v; }
    }

    public static class Upload {
        private int maxFileSizeMb = 50;

        public int getMaxFileSizeMb() { return maxFileSizeMb; }
        public void setMaxFileSizeMb(int v) { this.maxFileSizeMb = v; }
    }
}
