package exray.bridge.template;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import exray.bridge.error.TemplateNotFoundException;
import exray.bridge.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Read-only catalogue of workflow templates.
 * Templates are looked up in the configured directory first, then on the classpath
 * under {@code workflows/}. Callers always receive a private copy.
 */
public class WorkflowTemplateCatalog {

    private static final Logger log = LoggerFactory.getLogger(WorkflowTemplateCatalog.class);
    private static final Pattern SAFE_NAME = Pattern.compile("^[A-Za-z0-9_-]+$");
    private static final String CLASSPATH_PREFIX = "/workflows/";

    private final Path templateDir;
    private final Map<String, ObjectNode> cache = new ConcurrentHashMap<>();

    public WorkflowTemplateCatalog(Path templateDir) {
        this.templateDir = templateDir;
    }

    /**
     * Load a template by name.
     *
     * @throws TemplateNotFoundException if no template has that name
     */
    public ObjectNode load(String name) {
        if (name == null || !SAFE_NAME.matcher(name).matches()) {
            throw new TemplateNotFoundException(String.valueOf(name));
        }
        ObjectNode template = cache.computeIfAbsent(name, this::read);
        return template.deepCopy();
    }

    public boolean exists(String name) {
        try {
            load(name);
            return true;
        } catch (TemplateNotFoundException e) {
            return false;
        }
    }

    private ObjectNode read(String name) {
        if (templateDir != null) {
            for (String ext : new String[] { ".yaml", ".yml" }) {
                Path file = templateDir.resolve(name + ext);
                if (Files.isRegularFile(file)) {
                    try (InputStream in = Files.newInputStream(file)) {
                        log.debug("Loading workflow template {} from {}", name, file);
                        return parse(name, in);
                    } catch (IOException e) {
                        throw new TemplateNotFoundException(name, e);
                    }
                }
            }
        }

        try (InputStream in = WorkflowTemplateCatalog.class.getResourceAsStream(CLASSPATH_PREFIX + name + ".yaml")) {
            if (in == null) {
                throw new TemplateNotFoundException(name);
            }
            log.debug("Loading workflow template {} from classpath", name);
            return parse(name, in);
        } catch (IOException e) {
            throw new TemplateNotFoundException(name, e);
        }
    }

    private ObjectNode parse(String name, InputStream in) throws IOException {
        JsonNode root = Jsons.yaml().readTree(in);
        if (root == null || !root.isObject() || !root.path("spec").path("templates").isArray()) {
            throw new TemplateNotFoundException(name,
                    new IOException("template has no spec.templates list"));
        }
        return (ObjectNode) root;
    }
}
