package exray.bridge.model;

/**
 * Optional per-container CPU and memory limits, in Kubernetes quantity notation.
 * A null field means "keep the template default".
 */
public record ResourceLimits(String cpu, String memory) {

    private static final ResourceLimits NONE = new ResourceLimits(null, null);

    public ResourceLimits {
        cpu = blankToNull(cpu);
        memory = blankToNull(memory);
    }

    public static ResourceLimits none() {
        return NONE;
    }

    public boolean isEmpty() {
        return cpu == null && memory == null;
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }
}
