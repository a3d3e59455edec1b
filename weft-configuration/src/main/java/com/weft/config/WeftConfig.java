package com.weft.config;

import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Configuration loaded from environment variables for the weft orchestration engine.
 * <p>
 * Discovery index DB: WEFT_DB_URL, WEFT_DB_USER, WEFT_DB_PASSWORD (default is an embedded H2 file
 * database under ./data). Plugins: WEFT_PLUGINS_DIR (provider JARs), WEFT_MANIFEST_DIR (descriptor
 * JSON files). Scheduler: WEFT_CHAIN_PARALLELISM. Admission: WEFT_ADMISSION_ERROR_WINDOW.
 */
public final class WeftConfig {

    private static final String ENV_DB_URL = "WEFT_DB_URL";
    private static final String ENV_DB_USER = "WEFT_DB_USER";
    private static final String ENV_DB_PASSWORD = "WEFT_DB_PASSWORD";
    private static final String ENV_PLUGINS_DIR = "WEFT_PLUGINS_DIR";
    private static final String ENV_MANIFEST_DIR = "WEFT_MANIFEST_DIR";
    private static final String ENV_CHAIN_PARALLELISM = "WEFT_CHAIN_PARALLELISM";
    private static final String ENV_DISCOVERY_LIMIT = "WEFT_DISCOVERY_LIMIT";
    private static final String ENV_SUGGESTION_LIMIT = "WEFT_SUGGESTION_LIMIT";
    private static final String ENV_ADMISSION_ERROR_WINDOW = "WEFT_ADMISSION_ERROR_WINDOW";
    private static final String ENV_METRICS_ENABLED = "WEFT_METRICS_ENABLED";

    private static final String DEFAULT_DB_URL = "jdbc:h2:file:./data/weft-discovery";
    private static final String DEFAULT_DB_USER = "sa";
    private static final String DEFAULT_PLUGINS_DIR = "plugins";
    private static final String DEFAULT_MANIFEST_DIR = "plugins/manifests";
    public static final int DEFAULT_DISCOVERY_LIMIT = 5;
    public static final int DEFAULT_SUGGESTION_LIMIT = 5;
    public static final int DEFAULT_ADMISSION_ERROR_WINDOW = 20;
    private static final boolean DEFAULT_METRICS_ENABLED = true;

    private final String dbUrl;
    private final String dbUser;
    private final String dbPassword;
    private final String pluginsDir;
    private final String manifestDir;
    private final int chainParallelism;
    private final int discoveryLimit;
    private final int suggestionLimit;
    private final int admissionErrorWindow;
    private final boolean metricsEnabled;

    private WeftConfig(Builder b) {
        this.dbUrl = b.dbUrl != null ? b.dbUrl : DEFAULT_DB_URL;
        this.dbUser = b.dbUser != null ? b.dbUser : DEFAULT_DB_USER;
        this.dbPassword = b.dbPassword != null ? b.dbPassword : "";
        this.pluginsDir = b.pluginsDir != null ? b.pluginsDir : DEFAULT_PLUGINS_DIR;
        this.manifestDir = b.manifestDir != null ? b.manifestDir : DEFAULT_MANIFEST_DIR;
        this.chainParallelism = b.chainParallelism > 0 ? b.chainParallelism : defaultParallelism();
        this.discoveryLimit = b.discoveryLimit > 0 ? b.discoveryLimit : DEFAULT_DISCOVERY_LIMIT;
        this.suggestionLimit = b.suggestionLimit > 0 ? b.suggestionLimit : DEFAULT_SUGGESTION_LIMIT;
        this.admissionErrorWindow = b.admissionErrorWindow > 0 ? b.admissionErrorWindow : DEFAULT_ADMISSION_ERROR_WINDOW;
        this.metricsEnabled = b.metricsEnabled;
    }

    private static int defaultParallelism() {
        return Math.max(1, Runtime.getRuntime().availableProcessors());
    }

    /** JDBC URL of the discovery index (WEFT_DB_URL). Default {@value #DEFAULT_DB_URL}. */
    public String getDbUrl() {
        return dbUrl;
    }

    /** Database user (WEFT_DB_USER). Default "sa". */
    public String getDbUser() {
        return dbUser;
    }

    /** Database password (WEFT_DB_PASSWORD). Default "". */
    public String getDbPassword() {
        return dbPassword;
    }

    /** Directory scanned for plugin provider JARs. Default {@code plugins}. */
    public String getPluginsDir() {
        return pluginsDir;
    }

    /** Directory holding plugin descriptor manifests (*.json). Default {@code plugins/manifests}. */
    public String getManifestDir() {
        return manifestDir;
    }

    /** Thread count for parallel chain levels. Default: available processors. */
    public int getChainParallelism() {
        return chainParallelism;
    }

    /** Default number of candidates returned by a discovery query. */
    public int getDiscoveryLimit() {
        return discoveryLimit;
    }

    /** Maximum number of chain suggestions returned. */
    public int getSuggestionLimit() {
        return suggestionLimit;
    }

    /** Number of recent executions used for a plugin's rolling error frequency. Default 20. */
    public int getAdmissionErrorWindow() {
        return admissionErrorWindow;
    }

    public boolean isMetricsEnabled() {
        return metricsEnabled;
    }

    public static WeftConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /** Builds config from the given variables (tests pass a plain map instead of the process environment). */
    public static WeftConfig fromEnvironment(Map<String, String> env) {
        Objects.requireNonNull(env, "env");
        Function<String, String> get = env::get;
        return builder()
                .dbUrl(getEnv(get, ENV_DB_URL, DEFAULT_DB_URL))
                .dbUser(getEnv(get, ENV_DB_USER, DEFAULT_DB_USER))
                .dbPassword(getEnv(get, ENV_DB_PASSWORD, ""))
                .pluginsDir(getEnv(get, ENV_PLUGINS_DIR, DEFAULT_PLUGINS_DIR))
                .manifestDir(getEnv(get, ENV_MANIFEST_DIR, DEFAULT_MANIFEST_DIR))
                .chainParallelism(parseInt(get.apply(ENV_CHAIN_PARALLELISM), defaultParallelism()))
                .discoveryLimit(parseInt(get.apply(ENV_DISCOVERY_LIMIT), DEFAULT_DISCOVERY_LIMIT))
                .suggestionLimit(parseInt(get.apply(ENV_SUGGESTION_LIMIT), DEFAULT_SUGGESTION_LIMIT))
                .admissionErrorWindow(parseInt(get.apply(ENV_ADMISSION_ERROR_WINDOW), DEFAULT_ADMISSION_ERROR_WINDOW))
                .metricsEnabled(parseBoolean(get.apply(ENV_METRICS_ENABLED), DEFAULT_METRICS_ENABLED))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static boolean parseBoolean(String value, boolean defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return "true".equalsIgnoreCase(value.trim()) || "1".equals(value.trim());
    }

    private static int parseInt(String value, int defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static String getEnv(Function<String, String> env, String key, String defaultValue) {
        String v = env.apply(key);
        return (v != null && !v.isBlank()) ? v.trim() : defaultValue;
    }

    public static final class Builder {
        private String dbUrl = DEFAULT_DB_URL;
        private String dbUser = DEFAULT_DB_USER;
        private String dbPassword = "";
        private String pluginsDir = DEFAULT_PLUGINS_DIR;
        private String manifestDir = DEFAULT_MANIFEST_DIR;
        private int chainParallelism;
        private int discoveryLimit = DEFAULT_DISCOVERY_LIMIT;
        private int suggestionLimit = DEFAULT_SUGGESTION_LIMIT;
        private int admissionErrorWindow = DEFAULT_ADMISSION_ERROR_WINDOW;
        private boolean metricsEnabled = DEFAULT_METRICS_ENABLED;

        public Builder dbUrl(String dbUrl) {
            this.dbUrl = dbUrl;
            return this;
        }

        public Builder dbUser(String dbUser) {
            this.dbUser = dbUser;
            return this;
        }

        public Builder dbPassword(String dbPassword) {
            this.dbPassword = dbPassword;
            return this;
        }

        public Builder pluginsDir(String pluginsDir) {
            this.pluginsDir = pluginsDir;
            return this;
        }

        public Builder manifestDir(String manifestDir) {
            this.manifestDir = manifestDir;
            return this;
        }

        /** Zero or negative means "use available processors". */
        public Builder chainParallelism(int chainParallelism) {
            this.chainParallelism = chainParallelism;
            return this;
        }

        public Builder discoveryLimit(int discoveryLimit) {
            this.discoveryLimit = discoveryLimit;
            return this;
        }

        public Builder suggestionLimit(int suggestionLimit) {
            this.suggestionLimit = suggestionLimit;
            return this;
        }

        public Builder admissionErrorWindow(int admissionErrorWindow) {
            this.admissionErrorWindow = admissionErrorWindow;
            return this;
        }

        public Builder metricsEnabled(boolean metricsEnabled) {
            this.metricsEnabled = metricsEnabled;
            return this;
        }

        public WeftConfig build() {
            return new WeftConfig(this);
        }
    }
}
