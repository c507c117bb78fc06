package de.bsommerfeld.artifactsync.repository.pattern;

import de.bsommerfeld.artifactsync.core.domain.BuildReference;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A branch path template with every static placeholder substituted.
 *
 * <p>
 * The template is split at the <em>build segment</em>, the single path
 * segment that carries {@code {date}} and {@code {buildNumber}}:
 *
 * <pre>
 *   PAY/Gateway/develop / Build{date}.{buildNumber} / gateway.zip
 *   └── listingPrefix ──┘ └──── build segment ────┘ └ trailing ┘
 * </pre>
 *
 * The repository is listed at {@link #listingPrefix()}; each child name is
 * fed through {@link #match(String)}. When there are no trailing segments the
 * build segment names the artifact file itself.
 *
 * @param template          original template, for messages
 * @param listingPrefix     resolved segments before the build segment, joined
 *                          by {@code /}; empty if the build segment is first
 * @param buildSegment      build segment with static placeholders resolved
 * @param buildMatcher      matches a child name against the build segment
 * @param trailingSegments  segments after the build segment, static
 *                          placeholders resolved
 */
public record ResolvedPattern(String template, String listingPrefix, String buildSegment, Pattern buildMatcher,
        List<String> trailingSegments) {

    static final String DATE = "{date}";
    static final String BUILD_NUMBER = "{buildNumber}";

    public ResolvedPattern {
        trailingSegments = List.copyOf(trailingSegments);
    }

    /**
     * Parses a listing child into a build reference. Returns empty for names
     * that do not fit the build segment or carry an impossible date.
     */
    public Optional<BuildReference> match(String childName) {
        Matcher m = buildMatcher.matcher(childName);
        if (!m.matches()) return Optional.empty();
        return BuildReference.parse(m.group("date"), m.group("number"));
    }

    /** Whether listing children are the artifact files themselves. */
    public boolean artifactIsChild() {
        return trailingSegments.isEmpty();
    }

    /** Repository-relative path of the artifact for {@code build}. */
    public String artifactPath(BuildReference build) {
        List<String> parts = new ArrayList<>();
        if (!listingPrefix.isEmpty()) parts.add(listingPrefix);
        parts.add(render(buildSegment, build));
        for (String segment : trailingSegments) {
            parts.add(render(segment, build));
        }
        return String.join("/", parts);
    }

    /** Artifact file name, the last segment of {@link #artifactPath}. */
    public String artifactFileName(BuildReference build) {
        String path = artifactPath(build);
        return path.substring(path.lastIndexOf('/') + 1);
    }

    private static String render(String segment, BuildReference build) {
        return segment.replace(DATE, build.formattedDate())
                .replace(BUILD_NUMBER, String.valueOf(build.buildNumber()));
    }
}
