package com.synergi.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration for the orchestration engine, bound from {@code synergi.*}.
 * <p>
 * Example:
 * <pre>
 * synergi:
 *   orchestration:
 *     max-retries: 2
 *     timeouts:
 *       worker: 15s
 *   settlement:
 *     mode: simulated
 * </pre>
 */
@ConfigurationProperties(prefix = "synergi")
public class SynergiProperties {

    private Orchestration orchestration = new Orchestration();
    private Planner planner = new Planner();
    private Synthesis synthesis = new Synthesis();
    private Settlement settlement = new Settlement();
    private Registry registry = new Registry();

    public Orchestration getOrchestration() { return orchestration; }
    public void setOrchestration(Orchestration orchestration) { this.orchestration = orchestration; }

    public Planner getPlanner() { return planner; }
    public void setPlanner(Planner planner) { this.planner = planner; }

    public Synthesis getSynthesis() { return synthesis; }
    public void setSynthesis(Synthesis synthesis) { this.synthesis = synthesis; }

    public Settlement getSettlement() { return settlement; }
    public void setSettlement(Settlement settlement) { this.settlement = settlement; }

    public Registry getRegistry() { return registry; }
    public void setRegistry(Registry registry) { this.registry = registry; }

    public static class Orchestration {
        /** Alternative workers tried after the chosen one fails. */
        private int maxRetries = 2;
        /** Deepest delegation level accepted into the ledger. */
        private int maxDelegationDepth = 3;
        private double efficiencyConstant = 1.0;
        private double efficiencyEpsilon = 0.001;
        private BigDecimal defaultBudget = new BigDecimal("0.10");
        private Timeouts timeouts = new Timeouts();

        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }

        public int getMaxDelegationDepth() { return maxDelegationDepth; }
        public void setMaxDelegationDepth(int maxDelegationDepth) { this.maxDelegationDepth = maxDelegationDepth; }

        public double getEfficiencyConstant() { return efficiencyConstant; }
        public void setEfficiencyConstant(double efficiencyConstant) { this.efficiencyConstant = efficiencyConstant; }

        public double getEfficiencyEpsilon() { return efficiencyEpsilon; }
        public void setEfficiencyEpsilon(double efficiencyEpsilon) { this.efficiencyEpsilon = efficiencyEpsilon; }

        public BigDecimal getDefaultBudget() { return defaultBudget; }
        public void setDefaultBudget(BigDecimal defaultBudget) { this.defaultBudget = defaultBudget; }

        public Timeouts getTimeouts() { return timeouts; }
        public void setTimeouts(Timeouts timeouts) { this.timeouts = timeouts; }
    }

    public static class Timeouts {
        private Duration planner = Duration.ofSeconds(20);
        private Duration worker = Duration.ofSeconds(15);
        private Duration settlement = Duration.ofSeconds(10);
        private Duration summarizer = Duration.ofSeconds(20);

        public Duration getPlanner() { return planner; }
        public void setPlanner(Duration planner) { this.planner = planner; }

        public Duration getWorker() { return worker; }
        public void setWorker(Duration worker) { this.worker = worker; }

        public Duration getSettlement() { return settlement; }
        public void setSettlement(Duration settlement) { this.settlement = settlement; }

        public Duration getSummarizer() { return summarizer; }
        public void setSummarizer(Duration summarizer) { this.summarizer = summarizer; }
    }

    public static class Planner {
        private boolean llmEnabled = false;
        private String defaultCategory = "research";
        private List<KeywordRule> rules = new ArrayList<>();

        public boolean isLlmEnabled() { return llmEnabled; }
        public void setLlmEnabled(boolean llmEnabled) { this.llmEnabled = llmEnabled; }

        public String getDefaultCategory() { return defaultCategory; }
        public void setDefaultCategory(String defaultCategory) { this.defaultCategory = defaultCategory; }

        public List<KeywordRule> getRules() { return rules; }
        public void setRules(List<KeywordRule> rules) { this.rules = rules; }
    }

    /**
     * One fallback-planner rule. A keyword containing {@code +} matches only when every
     * part appears in the task text.
     */
    public static class KeywordRule {
        private String category;
        private List<String> keywords = new ArrayList<>();
        private String pattern;

        public KeywordRule() {}

        public KeywordRule(String category, List<String> keywords, String pattern) {
            this.category = category;
            this.keywords = keywords;
            this.pattern = pattern;
        }

        public String getCategory() { return category; }
        public void setCategory(String category) { this.category = category; }

        public List<String> getKeywords() { return keywords; }
        public void setKeywords(List<String> keywords) { this.keywords = keywords; }

        public String getPattern() { return pattern; }
        public void setPattern(String pattern) { this.pattern = pattern; }
    }

    public static class Synthesis {
        private boolean llmEnabled = false;

        public boolean isLlmEnabled() { return llmEnabled; }
        public void setLlmEnabled(boolean llmEnabled) { this.llmEnabled = llmEnabled; }
    }

    public static class Settlement {
        /** "simulated" or "facilitator". */
        private String mode = "simulated";
        private String network = "testnet";
        private String facilitatorUrl = "http://localhost:4021";
        /** Token workers are paid in: "STX" or "sBTC". */
        private String asset = "STX";
        private String explorerUrl = "https://explorer.hiro.so";

        public String getMode() { return mode; }
        public void setMode(String mode) { this.mode = mode; }

        public String getNetwork() { return network; }
        public void setNetwork(String network) { this.network = network; }

        public String getFacilitatorUrl() { return facilitatorUrl; }
        public void setFacilitatorUrl(String facilitatorUrl) { this.facilitatorUrl = facilitatorUrl; }

        public String getAsset() { return asset; }
        public void setAsset(String asset) { this.asset = asset; }

        public String getExplorerUrl() { return explorerUrl; }
        public void setExplorerUrl(String explorerUrl) { this.explorerUrl = explorerUrl; }
    }

    public static class Registry {
        private List<WorkerSeed> workers = new ArrayList<>();

        public List<WorkerSeed> getWorkers() { return workers; }
        public void setWorkers(List<WorkerSeed> workers) { this.workers = workers; }
    }

    public static class WorkerSeed {
        private String id;
        private String name;
        private String category;
        private String endpoint;
        /** Settlement address; defaults to the worker id. */
        private String address;
        private BigDecimal price;
        private int reputation;
        private boolean active = true;

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public String getCategory() { return category; }
        public void setCategory(String category) { this.category = category; }

        public String getEndpoint() { return endpoint; }
        public void setEndpoint(String endpoint) { this.endpoint = endpoint; }

        public String getAddress() { return address; }
        public void setAddress(String address) { this.address = address; }

        public BigDecimal getPrice() { return price; }
        public void setPrice(BigDecimal price) { this.price = price; }

        public int getReputation() { return reputation; }
        public void setReputation(int reputation) { this.reputation = reputation; }

        public boolean isActive() { return active; }
        public void setActive(boolean active) { this.active = active; }
    }
}
