package com.taskchat;

import com.taskchat.chat.TurnSettings;
import com.taskchat.reasoning.OpenAiReasoningEngine;

import java.io.IOException;
import java.net.ServerSocket;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Map;

/**
 * Application configuration. Command-line flags win over environment
 * variables, which win over built-in defaults. Read-only after startup.
 */
public class AppConfig {

    private static final String APP_NAME = "TaskChat";

    private final int port;
    private final Path databasePath;
    private final Path logPath;
    private final boolean devMode;
    private final String jwtSecret;
    private final String reasoningUrl;
    private final String reasoningModel;
    private final String reasoningApiKey;
    private final TurnSettings turnSettings;

    private AppConfig(Builder builder, int port, Path databasePath, Path logPath, TurnSettings turnSettings) {
        this.port = port;
        this.databasePath = databasePath;
        this.logPath = logPath;
        this.devMode = builder.devMode;
        this.jwtSecret = builder.jwtSecret;
        this.reasoningUrl = builder.reasoningUrl;
        this.reasoningModel = builder.reasoningModel;
        this.reasoningApiKey = builder.reasoningApiKey;
        this.turnSettings = turnSettings;
    }

    public int getPort() {
        return port;
    }

    public Path getDatabasePath() {
        return databasePath;
    }

    public Path getLogPath() {
        return logPath;
    }

    public boolean isDevMode() {
        return devMode;
    }

    public String getJwtSecret() {
        return jwtSecret;
    }

    public String getReasoningUrl() {
        return reasoningUrl;
    }

    public String getReasoningModel() {
        return reasoningModel;
    }

    public String getReasoningApiKey() {
        return reasoningApiKey;
    }

    public TurnSettings getTurnSettings() {
        return turnSettings;
    }

    /**
     * Per-user data directory.
     * Windows: %APPDATA%\TaskChat
     * macOS: ~/Library/Application Support/TaskChat
     * Linux: ~/.local/share/TaskChat
     */
    public static Path getDataDirectory() {
        String os = System.getProperty("os.name").toLowerCase(Locale.ROOT);
        String userHome = System.getProperty("user.home");

        if (os.contains("win")) {
            String appData = System.getenv("APPDATA");
            if (appData == null) {
                appData = Paths.get(userHome, "AppData", "Roaming").toString();
            }
            return Paths.get(appData, APP_NAME);
        } else if (os.contains("mac")) {
            return Paths.get(userHome, "Library", "Application Support", APP_NAME);
        } else {
            return Paths.get(userHome, ".local", "share", APP_NAME);
        }
    }

    /**
     * Returns the preferred port if it is free, otherwise any free port.
     */
    public static int findAvailablePort(int preferredPort) {
        if (isPortAvailable(preferredPort)) {
            return preferredPort;
        }
        try (ServerSocket socket = new ServerSocket(0)) {
            socket.setReuseAddress(true);
            return socket.getLocalPort();
        } catch (IOException e) {
            for (int port = preferredPort + 1; port < preferredPort + 100; port++) {
                if (isPortAvailable(port)) {
                    return port;
                }
            }
        }
        // Let the server fail to bind with a clear error.
        return preferredPort;
    }

    public static boolean isPortAvailable(int port) {
        try (ServerSocket socket = new ServerSocket(port)) {
            socket.setReuseAddress(true);
            return true;
        } catch (IOException e) {
            return false;
        }
    }

    /**
     * Builder for AppConfig.
     */
    public static class Builder {
        private Map<String, String> environment = System.getenv();
        private Integer preferredPort;
        private String databasePath;
        private boolean devMode;
        private boolean devModeSet;
        private String jwtSecret;
        private String reasoningUrl;
        private String reasoningModel;
        private String reasoningApiKey;
        private Integer historyLimit;
        private Integer maxToolCalls;
        private Long turnTimeoutMs;
        private Long reasoningTimeoutMs;
        private boolean probePort = true;

        public Builder environment(Map<String, String> environment) {
            this.environment = environment != null ? environment : Map.of();
            return this;
        }

        public Builder port(int port) {
            this.preferredPort = port;
            return this;
        }

        public Builder databasePath(String path) {
            if (path != null && !path.isBlank()) {
                this.databasePath = path.trim();
            }
            return this;
        }

        public Builder devMode(boolean devMode) {
            this.devMode = devMode;
            this.devModeSet = true;
            return this;
        }

        public Builder jwtSecret(String secret) {
            this.jwtSecret = secret;
            return this;
        }

        /**
         * Skips the free-port probe and uses the configured port as is.
         */
        public Builder exactPort() {
            this.probePort = false;
            return this;
        }

        public Builder parseArgs(String[] args) {
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                if ("--dev".equals(arg)) {
                    devMode(true);
                    continue;
                }
                if (!arg.startsWith("--")) {
                    continue;
                }
                String name;
                String value;
                int eq = arg.indexOf('=');
                if (eq > 0) {
                    name = arg.substring(2, eq);
                    value = arg.substring(eq + 1);
                } else if (i + 1 < args.length) {
                    name = arg.substring(2);
                    value = args[++i];
                } else {
                    throw new IllegalArgumentException("Missing value for " + arg);
                }
                applyFlag(name, value);
            }
            return this;
        }

        private void applyFlag(String name, String value) {
            switch (name) {
                case "port":
                    preferredPort = parseInt("--port", value);
                    break;
                case "db":
                    databasePath(value);
                    break;
                case "jwt-secret":
                    jwtSecret = value;
                    break;
                case "reasoning-url":
                    reasoningUrl = value;
                    break;
                case "reasoning-model":
                    reasoningModel = value;
                    break;
                case "history-limit":
                    historyLimit = parseInt("--history-limit", value);
                    break;
                case "max-tool-calls":
                    maxToolCalls = parseInt("--max-tool-calls", value);
                    break;
                case "turn-timeout-ms":
                    turnTimeoutMs = parseLong("--turn-timeout-ms", value);
                    break;
                case "reasoning-timeout-ms":
                    reasoningTimeoutMs = parseLong("--reasoning-timeout-ms", value);
                    break;
                default:
                    throw new IllegalArgumentException("Unknown option: --" + name);
            }
        }

        public AppConfig build() throws IOException {
            int port = preferredPort != null ? preferredPort : intEnv("TASKCHAT_PORT", 8080);
            if (probePort) {
                port = findAvailablePort(port);
            }
            if (!devModeSet) {
                devMode = Boolean.parseBoolean(env("TASKCHAT_DEV", "false"));
            }
            jwtSecret = firstNonBlank(jwtSecret, env("TASKCHAT_JWT_SECRET", null));
            reasoningUrl = firstNonBlank(reasoningUrl,
                env("TASKCHAT_REASONING_URL", OpenAiReasoningEngine.DEFAULT_BASE_URL));
            reasoningModel = firstNonBlank(reasoningModel,
                env("TASKCHAT_REASONING_MODEL", OpenAiReasoningEngine.DEFAULT_MODEL));
            reasoningApiKey = firstNonBlank(reasoningApiKey, env("TASKCHAT_REASONING_API_KEY", null));

            Path dataDir = getDataDirectory();
            String dbSetting = firstNonBlank(databasePath, env("TASKCHAT_DB", null));
            Path dbPath = dbSetting != null
                ? Paths.get(dbSetting).toAbsolutePath().normalize()
                : dataDir.resolve("taskchat.db");
            Path logPath = dataDir.resolve("logs").resolve("taskchat.log");
            Files.createDirectories(logPath.getParent());

            TurnSettings turnSettings = new TurnSettings(
                historyLimit != null ? historyLimit : intEnv("TASKCHAT_HISTORY_LIMIT", TurnSettings.DEFAULT_HISTORY_LIMIT),
                maxToolCalls != null ? maxToolCalls : intEnv("TASKCHAT_MAX_TOOL_CALLS", TurnSettings.DEFAULT_MAX_TOOL_CALLS),
                turnTimeoutMs != null ? turnTimeoutMs
                    : longEnv("TASKCHAT_TURN_TIMEOUT_MS", TurnSettings.DEFAULT_TURN_TIMEOUT_MS),
                reasoningTimeoutMs != null ? reasoningTimeoutMs
                    : longEnv("TASKCHAT_REASONING_TIMEOUT_MS", TurnSettings.DEFAULT_REASONING_TIMEOUT_MS));

            return new AppConfig(this, port, dbPath, logPath, turnSettings);
        }

        private String env(String name, String fallback) {
            String value = environment.get(name);
            return value == null || value.isBlank() ? fallback : value.trim();
        }

        private int intEnv(String name, int fallback) {
            String value = env(name, null);
            return value == null ? fallback : parseInt(name, value);
        }

        private long longEnv(String name, long fallback) {
            String value = env(name, null);
            return value == null ? fallback : parseLong(name, value);
        }

        private static int parseInt(String name, String value) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid number for " + name + ": " + value, e);
            }
        }

        private static long parseLong(String name, String value) {
            try {
                return Long.parseLong(value.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid number for " + name + ": " + value, e);
            }
        }

        private static String firstNonBlank(String first, String second) {
            if (first != null && !first.isBlank()) {
                return first.trim();
            }
            return second;
        }
    }
}
