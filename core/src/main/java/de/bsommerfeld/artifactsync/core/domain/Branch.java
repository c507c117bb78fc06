package de.bsommerfeld.artifactsync.core.domain;

import java.util.Objects;

/**
 * A named build stream of a component (e.g. {@code develop},
 * {@code release/2.4}).
 *
 * @param id                  stable catalog key
 * @param componentId         owning component
 * @param name                branch name, unique within the component
 * @param status              lifecycle status
 * @param version             administration-owned product version
 * @param autoIncrement       which version part advances per release
 * @param pathPatternOverride repository path template for this branch, or
 *                            {@code null} to use the configured default
 * @param description         free text, may be {@code null}
 */
public record Branch(long id, long componentId, String name, BranchStatus status, VersionTuple version,
        AutoIncrement autoIncrement, String pathPatternOverride, String description) {

    public Branch {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(version, "version");
        Objects.requireNonNull(autoIncrement, "autoIncrement");
    }

    public boolean isActive() {
        return status == BranchStatus.ACTIVE;
    }

    public boolean hasPatternOverride() {
        return pathPatternOverride != null && !pathPatternOverride.isBlank();
    }

    /**
     * Branch name made safe for a single path segment. Gitflow names such as
     * {@code feature/login} become {@code feature-login}.
     */
    public String pathSafeName() {
        return name.replace('/', '-').replace('\\', '-');
    }
}
