package exray.bridge.cluster;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Parsing of Kubernetes CPU and memory quantity strings.
 * Anything unparseable counts as zero.
 */
final class ResourceQuantities {

    private static final double KI_PER_GI = 1024.0 * 1024.0;
    private static final double MI_PER_GI = 1024.0;

    private ResourceQuantities() {
    }

    /** "250m" is 0.25 cores, "4" is 4 cores. */
    static double cpuCores(String quantity) {
        if (quantity == null || quantity.isBlank()) {
            return 0.0;
        }
        String value = quantity.trim();
        try {
            if (value.endsWith("m")) {
                return Double.parseDouble(value.substring(0, value.length() - 1)) / 1000.0;
            }
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            return 0.0;
        }
    }

    /** Ki, Mi and Gi suffixes only; other notations count as zero. */
    static double memoryGb(String quantity) {
        if (quantity == null || quantity.isBlank()) {
            return 0.0;
        }
        String value = quantity.trim();
        try {
            if (value.endsWith("Ki")) {
                return Double.parseDouble(value.substring(0, value.length() - 2)) / KI_PER_GI;
            }
            if (value.endsWith("Mi")) {
                return Double.parseDouble(value.substring(0, value.length() - 2)) / MI_PER_GI;
            }
            if (value.endsWith("Gi")) {
                return Double.parseDouble(value.substring(0, value.length() - 2));
            }
            return 0.0;
        } catch (NumberFormatException e) {
            return 0.0;
        }
    }

    static double round(double value, int places) {
        return BigDecimal.valueOf(value).setScale(places, RoundingMode.HALF_UP).doubleValue();
    }
}
