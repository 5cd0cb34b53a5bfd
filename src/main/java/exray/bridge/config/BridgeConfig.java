package exray.bridge.config;

import org.ini4j.Ini;
import org.ini4j.Profile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;

/**
 * Configuration holder for the bridge.
 * Defaults, then an optional INI file, then EXRAY_* environment variables.
 */
public final class BridgeConfig {

    public enum RegistryBackend {
        JDBC, FILE
    }

    // Server settings
    private String serverHost = "0.0.0.0";
    private int serverPort = 8000;
    private int workerThreads = 8;

    // Registry settings
    private RegistryBackend registryBackend = RegistryBackend.JDBC;
    private String databaseUrl = "jdbc:h2:file:./data/exray;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 5;
    private Path registryFile = Paths.get(System.getProperty("user.home"), "exray_data.json");

    // Workflow engine settings
    private String engineUrl = "https://localhost:2746";
    private String engineNamespace = "argo";
    private boolean engineInsecureTls = true;
    private String engineToken = null;
    private Duration engineTimeout = Duration.ofSeconds(5);
    private Duration engineSubmitTimeout = Duration.ofSeconds(10);
    private int defaultLogTailLines = 200;

    // Artifact store settings
    private String artifactEndpoint = "http://127.0.0.1:9000";
    private String artifactAccessKey = "admin";
    private String artifactSecretKey = "password";
    private String artifactBucket = "inputs";
    private Duration presignTtl = Duration.ofHours(1);

    // Templates
    private Path templateDir = null; // null: classpath workflows/<kind>.yaml

    // Cluster
    private Path kubeconfigPath = Paths.get("_ansible", "kubeconfig");

    private BridgeConfig() {
    }

    public static BridgeConfig defaults() {
        return new BridgeConfig();
    }

    /**
     * Load the INI file (if it exists) on top of defaults, then apply the environment.
     */
    public static BridgeConfig load(Path iniFile) throws IOException {
        BridgeConfig config = defaults();
        if (iniFile != null && Files.isRegularFile(iniFile)) {
            config.applyIni(new Ini(iniFile.toFile()));
        }
        return config.applyEnv(System.getenv());
    }

    BridgeConfig applyIni(Ini ini) {
        Profile.Section server = ini.get("server");
        if (server != null) {
            serverHost = opt(server, "host", serverHost);
            serverPort = Integer.parseInt(opt(server, "port", String.valueOf(serverPort)));
            workerThreads = Integer.parseInt(opt(server, "worker_threads", String.valueOf(workerThreads)));
        }

        Profile.Section registry = ini.get("registry");
        if (registry != null) {
            registryBackend = parseBackend(opt(registry, "backend", registryBackend.name()));
            databaseUrl = opt(registry, "database_url", databaseUrl);
            databasePoolSize = Integer.parseInt(opt(registry, "pool_size", String.valueOf(databasePoolSize)));
            String file = opt(registry, "file", null);
            if (file != null) {
                registryFile = Paths.get(file);
            }
        }

        Profile.Section engine = ini.get("engine");
        if (engine != null) {
            engineUrl = opt(engine, "url", engineUrl);
            engineNamespace = opt(engine, "namespace", engineNamespace);
            engineInsecureTls = Boolean.parseBoolean(opt(engine, "insecure_tls", String.valueOf(engineInsecureTls)));
            engineToken = opt(engine, "token", engineToken);
            engineTimeout = Duration.ofSeconds(
                    Long.parseLong(opt(engine, "timeout_seconds", String.valueOf(engineTimeout.toSeconds()))));
            engineSubmitTimeout = Duration.ofSeconds(Long.parseLong(
                    opt(engine, "submit_timeout_seconds", String.valueOf(engineSubmitTimeout.toSeconds()))));
            defaultLogTailLines = Integer.parseInt(opt(engine, "log_tail_lines", String.valueOf(defaultLogTailLines)));
        }

        Profile.Section artifacts = ini.get("artifacts");
        if (artifacts != null) {
            artifactEndpoint = opt(artifacts, "endpoint", artifactEndpoint);
            artifactAccessKey = opt(artifacts, "access_key", artifactAccessKey);
            artifactSecretKey = opt(artifacts, "secret_key", artifactSecretKey);
            artifactBucket = opt(artifacts, "bucket", artifactBucket);
            presignTtl = Duration.ofMinutes(
                    Long.parseLong(opt(artifacts, "presign_ttl_minutes", String.valueOf(presignTtl.toMinutes()))));
        }

        Profile.Section templates = ini.get("templates");
        if (templates != null) {
            String dir = opt(templates, "dir", null);
            if (dir != null) {
                templateDir = Paths.get(dir);
            }
        }

        Profile.Section cluster = ini.get("cluster");
        if (cluster != null) {
            String kubeconfig = opt(cluster, "kubeconfig", null);
            if (kubeconfig != null) {
                kubeconfigPath = Paths.get(kubeconfig);
            }
        }
        return this;
    }

    BridgeConfig applyEnv(Map<String, String> env) {
        String port = env.get("EXRAY_PORT");
        if (isSet(port)) {
            serverPort = Integer.parseInt(port);
        }
        String backend = env.get("EXRAY_REGISTRY_BACKEND");
        if (isSet(backend)) {
            registryBackend = parseBackend(backend);
        }
        String dbUrl = env.get("EXRAY_DB_URL");
        if (isSet(dbUrl)) {
            databaseUrl = dbUrl;
        }
        String registry = env.get("EXRAY_REGISTRY_FILE");
        if (isSet(registry)) {
            registryFile = Paths.get(registry);
        }
        String engine = env.get("EXRAY_ENGINE_URL");
        if (isSet(engine)) {
            engineUrl = engine;
        }
        String namespace = env.get("EXRAY_ENGINE_NAMESPACE");
        if (isSet(namespace)) {
            engineNamespace = namespace;
        }
        String token = env.get("EXRAY_ENGINE_TOKEN");
        if (isSet(token)) {
            engineToken = token;
        }
        String endpoint = env.get("EXRAY_MINIO_ENDPOINT");
        if (isSet(endpoint)) {
            artifactEndpoint = endpoint;
        }
        String accessKey = env.get("EXRAY_MINIO_ACCESS_KEY");
        if (isSet(accessKey)) {
            artifactAccessKey = accessKey;
        }
        String secretKey = env.get("EXRAY_MINIO_SECRET_KEY");
        if (isSet(secretKey)) {
            artifactSecretKey = secretKey;
        }
        String bucket = env.get("EXRAY_MINIO_BUCKET");
        if (isSet(bucket)) {
            artifactBucket = bucket;
        }
        String templates = env.get("EXRAY_TEMPLATE_DIR");
        if (isSet(templates)) {
            templateDir = Paths.get(templates);
        }
        String kubeconfig = env.get("EXRAY_KUBECONFIG");
        if (isSet(kubeconfig)) {
            kubeconfigPath = Paths.get(kubeconfig);
        }
        return this;
    }

    private static RegistryBackend parseBackend(String raw) {
        try {
            return RegistryBackend.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown registry backend: " + raw, e);
        }
    }

    private static String opt(Profile.Section section, String key, String fallback) {
        String value = section.get(key);
        return isSet(value) ? value.trim() : fallback;
    }

    private static boolean isSet(String value) {
        return value != null && !value.isBlank();
    }

    // Getters
    public String serverHost() {
        return serverHost;
    }

    public int serverPort() {
        return serverPort;
    }

    public int workerThreads() {
        return workerThreads;
    }

    public RegistryBackend registryBackend() {
        return registryBackend;
    }

    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public Path registryFile() {
        return registryFile;
    }

    public String engineUrl() {
        return engineUrl;
    }

    public String engineNamespace() {
        return engineNamespace;
    }

    public boolean engineInsecureTls() {
        return engineInsecureTls;
    }

    public String engineToken() {
        return engineToken;
    }

    public Duration engineTimeout() {
        return engineTimeout;
    }

    public Duration engineSubmitTimeout() {
        return engineSubmitTimeout;
    }

    public int defaultLogTailLines() {
        return defaultLogTailLines;
    }

    public String artifactEndpoint() {
        return artifactEndpoint;
    }

    public String artifactAccessKey() {
        return artifactAccessKey;
    }

    public String artifactSecretKey() {
        return artifactSecretKey;
    }

    public String artifactBucket() {
        return artifactBucket;
    }

    public Duration presignTtl() {
        return presignTtl;
    }

    public Path templateDir() {
        return templateDir;
    }

    public Path kubeconfigPath() {
        return kubeconfigPath;
    }

    // Fluent setters for testing/customization
    public BridgeConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    public BridgeConfig withRegistryBackend(RegistryBackend backend) {
        this.registryBackend = backend;
        return this;
    }

    public BridgeConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public BridgeConfig withRegistryFile(Path file) {
        this.registryFile = file;
        return this;
    }

    public BridgeConfig withEngineUrl(String url) {
        this.engineUrl = url;
        return this;
    }

    public BridgeConfig withEngineNamespace(String namespace) {
        this.engineNamespace = namespace;
        return this;
    }

    public BridgeConfig withEngineTimeout(Duration timeout) {
        this.engineTimeout = timeout;
        return this;
    }

    public BridgeConfig withArtifactBucket(String bucket) {
        this.artifactBucket = bucket;
        return this;
    }

    public BridgeConfig withTemplateDir(Path dir) {
        this.templateDir = dir;
        return this;
    }

    public BridgeConfig withDefaultLogTailLines(int lines) {
        this.defaultLogTailLines = lines;
        return this;
    }

    @Override
    public String toString() {
        return "BridgeConfig{" +
                "serverPort=" + serverPort +
                ", registryBackend=" + registryBackend +
                ", engineUrl='" + engineUrl + '\'' +
                ", engineNamespace='" + engineNamespace + '\'' +
                ", artifactEndpoint='" + artifactEndpoint + '\'' +
                ", artifactBucket='" + artifactBucket + '\'' +
                ", templateDir=" + templateDir +
                '}';
    }
}
