package de.bsommerfeld.artifactsync.core.domain;

import java.util.Objects;

/**
 * Deployable unit of a project, as maintained by project administration.
 * The project attributes are denormalized onto the component because path
 * templates reference them directly.
 *
 * @param id              stable catalog key
 * @param projectId       owning project key
 * @param projectShortKey short project key (e.g. {@code WEBAPP01}), may be
 *                        {@code null} if administration never set one
 * @param projectName     display name of the project, may be {@code null}
 * @param name            component name, also used in repository paths
 * @param enabled         whether the component takes part in synchronization
 */
public record Component(long id, long projectId, String projectShortKey, String projectName,
        String name, boolean enabled) {

    public Component {
        Objects.requireNonNull(name, "name");
    }
}
