package exray.bridge.util;

/**
 * Helpers for user-supplied file names.
 */
public final class FileNames {

    public static final String DEFAULT_DATA_FILE = "dataset.csv";
    public static final String DEFAULT_SCRIPT_FILE = "script.py";

    private FileNames() {
    }

    /**
     * Base name only, spaces replaced with underscores; the fallback when nothing usable remains.
     */
    public static String sanitize(String filename, String fallback) {
        if (filename == null) {
            return fallback;
        }
        String name = filename;
        int slash = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
        if (slash >= 0) {
            name = name.substring(slash + 1);
        }
        if (name.equals(".") || name.equals("..")) {
            name = "";
        }
        name = name.replace(' ', '_');
        return name.isEmpty() ? fallback : name;
    }

    public static String sanitize(String filename) {
        return sanitize(filename, DEFAULT_DATA_FILE);
    }
}
