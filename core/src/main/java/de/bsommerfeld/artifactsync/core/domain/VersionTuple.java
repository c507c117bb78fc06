package de.bsommerfeld.artifactsync.core.domain;

/**
 * Four-part product version of a branch. Owned by administration; the engine
 * reads it and renders it but never persists a change to it.
 */
public record VersionTuple(int major, int minor, int patch, int build) {

    public static final VersionTuple INITIAL = new VersionTuple(1, 0, 0, 0);

    public VersionTuple {
        if (major < 0 || minor < 0 || patch < 0 || build < 0) {
            throw new IllegalArgumentException(
                    "Version components must be >= 0: " + major + "." + minor + "." + patch + "." + build);
        }
    }

    /**
     * Parses {@code major.minor.patch.build}. Missing trailing parts default
     * to zero, so {@code "2.1"} becomes {@code 2.1.0.0}.
     *
     * @throws IllegalArgumentException for blank input, more than four parts
     *                                  or non-numeric parts
     */
    public static VersionTuple parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Version must not be blank");
        }
        String[] parts = text.strip().split("\\.");
        if (parts.length > 4) {
            throw new IllegalArgumentException("Expected at most four version parts, got: " + text);
        }
        int[] values = new int[4];
        for (int i = 0; i < parts.length; i++) {
            try {
                values[i] = Integer.parseInt(parts[i]);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Non-numeric version part '" + parts[i] + "' in " + text, e);
            }
        }
        return new VersionTuple(values[0], values[1], values[2], values[3]);
    }

    /** Renders {@code {major}.{minor}.{patch}.{build}}. */
    public String render() {
        return major + "." + minor + "." + patch + "." + build;
    }

    @Override
    public String toString() {
        return render();
    }
}
