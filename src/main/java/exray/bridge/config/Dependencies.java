package exray.bridge.config;

import exray.bridge.api.v1.HealthController;
import exray.bridge.api.v1.RunController;
import exray.bridge.artifact.ArtifactStore;
import exray.bridge.artifact.MinioArtifactStore;
import exray.bridge.cluster.ClusterInfoProvider;
import exray.bridge.cluster.KubernetesClusterInfoProvider;
import exray.bridge.engine.ArgoWorkflowClient;
import exray.bridge.engine.WorkflowEngineClient;
import exray.bridge.repository.RunRepository;
import exray.bridge.server.RouterHandler;
import exray.bridge.service.RunOrchestrator;
import exray.bridge.store.Database;
import exray.bridge.store.JdbcRunRepository;
import exray.bridge.store.JsonFileRunRepository;
import exray.bridge.template.SpecTemplater;
import exray.bridge.template.WorkflowTemplateCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Manual dependency injection container.
 * Creates and wires all service dependencies.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(BridgeConfig.load(iniFile));
 * RunOrchestrator orchestrator = deps.orchestrator();
 * // ... use services ...
 * deps.close(); // cleanup
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final BridgeConfig config;
    private final Database database; // null for the file backend
    private final RunRepository runRepository;
    private final WorkflowTemplateCatalog templateCatalog;
    private final SpecTemplater templater;
    private final WorkflowEngineClient engine;
    private final ArtifactStore artifactStore;
    private final ClusterInfoProvider clusterInfo;
    private final RunOrchestrator orchestrator;

    // Controllers
    private final HealthController healthController;
    private final RunController runController;

    // Router (lazy-initialized)
    private RouterHandler routerHandler;

    private Dependencies(BridgeConfig config, WorkflowEngineClient engine, ArtifactStore artifactStore,
            ClusterInfoProvider clusterInfo) {
        this.config = config;

        log.info("Initializing dependencies with config: {}", config);

        // Registry
        if (config.registryBackend() == BridgeConfig.RegistryBackend.FILE) {
            this.database = null;
            this.runRepository = new JsonFileRunRepository(config.registryFile());
        } else {
            this.database = new Database(config);
            this.runRepository = new JdbcRunRepository(database);
        }

        // Templates
        this.templateCatalog = new WorkflowTemplateCatalog(config.templateDir());
        this.templater = new SpecTemplater(templateCatalog, config.artifactBucket());

        // Remote systems
        this.engine = engine;
        this.artifactStore = artifactStore;
        this.clusterInfo = clusterInfo;

        // Services
        this.orchestrator = new RunOrchestrator(runRepository, templater, engine, artifactStore, config);

        // Controllers
        this.healthController = new HealthController(engine, artifactStore, clusterInfo);
        this.runController = new RunController(orchestrator);

        log.info("Dependencies initialized successfully ({} registry)", config.registryBackend());
    }

    /**
     * Create dependencies with the given config.
     */
    public static Dependencies create(BridgeConfig config) {
        return new Dependencies(config,
                new ArgoWorkflowClient(config),
                new MinioArtifactStore(config),
                new KubernetesClusterInfoProvider(config.kubeconfigPath()));
    }

    /**
     * Create dependencies with replacement remote systems.
     */
    public static Dependencies create(BridgeConfig config, WorkflowEngineClient engine, ArtifactStore artifactStore,
            ClusterInfoProvider clusterInfo) {
        return new Dependencies(config, engine, artifactStore, clusterInfo);
    }

    // Getters
    public BridgeConfig config() {
        return config;
    }

    public RunRepository runRepository() {
        return runRepository;
    }

    public SpecTemplater templater() {
        return templater;
    }

    public WorkflowEngineClient engine() {
        return engine;
    }

    public ArtifactStore artifactStore() {
        return artifactStore;
    }

    public RunOrchestrator orchestrator() {
        return orchestrator;
    }

    /**
     * Get a fully configured RouterHandler with all controllers registered.
     * This is the main entry point for serving HTTP requests.
     */
    public synchronized RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler()
                    .registerController(healthController)
                    .registerController(runController);
            log.info("RouterHandler created with {} controllers", routerHandler.controllerCount());
        }
        return routerHandler;
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");
        if (database != null) {
            try {
                database.close();
            } catch (Exception e) {
                log.warn("Error closing database: {}", e.getMessage());
            }
        }
        log.info("Dependencies closed");
    }
}
