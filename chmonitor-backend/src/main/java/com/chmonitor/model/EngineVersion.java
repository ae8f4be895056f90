package com.chmonitor.model;

import java.util.Comparator;
import java.util.Objects;

/**
 * Parsed ClickHouse version such as {@code 24.3.1.1}.
 *
 * <p>Comparison is numeric on major, minor and patch; the build number is informational.
 */
public final class EngineVersion implements Comparable<EngineVersion> {
    private static final Comparator<EngineVersion> ORDER = Comparator
            .comparingInt(EngineVersion::getMajor)
            .thenComparingInt(EngineVersion::getMinor)
            .thenComparingInt(EngineVersion::getPatch);

    private final int major;
    private final int minor;
    private final int patch;
    private final Integer build;
    private final String raw;

    private EngineVersion(int major, int minor, int patch, Integer build, String raw) {
        this.major = major;
        this.minor = minor;
        this.patch = patch;
        this.build = build;
        this.raw = raw;
    }

    /**
     * Parses a dot separated version. The major component must start with a digit. Missing or
     * non-numeric later components count as zero; a component like {@code 3-lts} contributes its
     * leading digits.
     *
     * @param version version text
     * @return parsed version
     */
    public static EngineVersion parse(String version) {
        if (version == null || version.isBlank()) {
            throw new IllegalArgumentException("Version must not be blank");
        }
        String trimmed = version.trim();
        String[] parts = trimmed.split("\\.");
        if (parts.length == 0 || parts[0].isEmpty() || !Character.isDigit(parts[0].charAt(0))) {
            throw new IllegalArgumentException("Invalid version: " + version);
        }
        return new EngineVersion(
                component(parts, 0),
                component(parts, 1),
                component(parts, 2),
                parts.length > 3 ? component(parts, 3) : null,
                trimmed
        );
    }

    private static int component(String[] parts, int index) {
        if (index >= parts.length) {
            return 0;
        }
        String part = parts[index];
        int end = 0;
        while (end < part.length() && Character.isDigit(part.charAt(end))) {
            end++;
        }
        if (end == 0) {
            return 0;
        }
        return Integer.parseInt(part.substring(0, end));
    }

    public int getMajor() {
        return major;
    }

    public int getMinor() {
        return minor;
    }

    public int getPatch() {
        return patch;
    }

    public Integer getBuild() {
        return build;
    }

    public String getRaw() {
        return raw;
    }

    public boolean isAtLeast(EngineVersion other) {
        return compareTo(other) >= 0;
    }

    @Override
    public int compareTo(EngineVersion other) {
        return ORDER.compare(this, other);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EngineVersion that)) {
            return false;
        }
        return major == that.major && minor == that.minor && patch == that.patch;
    }

    @Override
    public int hashCode() {
        return Objects.hash(major, minor, patch);
    }

    @Override
    public String toString() {
        return raw;
    }
}
