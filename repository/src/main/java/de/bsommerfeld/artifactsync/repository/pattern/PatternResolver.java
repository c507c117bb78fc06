package de.bsommerfeld.artifactsync.repository.pattern;

import de.bsommerfeld.artifactsync.core.domain.Branch;
import de.bsommerfeld.artifactsync.core.domain.Component;
import de.bsommerfeld.artifactsync.core.domain.SyncTarget;
import de.bsommerfeld.artifactsync.core.error.TemplateException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Expands a branch path template into a {@link ResolvedPattern}. Pure, no
 * I/O.
 *
 * <h3>Placeholders</h3>
 * <ul>
 * <li>{@code {ProjectShortKey}}, {@code {ProjectName}}: project fields,
 * required when referenced</li>
 * <li>{@code {ComponentName}}: component name as stored</li>
 * <li>{@code {componentName}}: component name lower-cased</li>
 * <li>{@code {branch}}: branch name with {@code /} replaced by {@code -}</li>
 * <li>{@code {date}}, {@code {buildNumber}}: build reference, resolved per
 * candidate</li>
 * </ul>
 *
 * The first segment that mentions {@code {date}} or {@code {buildNumber}} is
 * the build segment and must contain each of them exactly once. Later
 * segments may repeat them.
 */
public final class PatternResolver {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([^{}]*)}");

    private static final Set<String> KNOWN = Set.of(
            "ProjectShortKey", "ProjectName", "ComponentName", "componentName", "branch", "date", "buildNumber");

    private PatternResolver() {
    }

    /**
     * Resolves the branch's override, or {@code defaultTemplate} if the
     * branch has none.
     *
     * @throws TemplateException if the template is unusable
     */
    public static ResolvedPattern resolve(SyncTarget target, String defaultTemplate) throws TemplateException {
        Branch branch = target.branch();
        String template = branch.hasPatternOverride() ? branch.pathPatternOverride() : defaultTemplate;
        return resolve(template, target.component(), branch);
    }

    public static ResolvedPattern resolve(String template, Component component, Branch branch)
            throws TemplateException {
        if (template == null || template.isBlank()) {
            throw new TemplateException("Path template is blank for branch " + branch.name());
        }

        String normalized = trimSlashes(template.strip().replace('\\', '/'));
        List<String> segments = Arrays.stream(normalized.split("/+")).toList();

        int buildIndex = -1;
        for (int i = 0; i < segments.size(); i++) {
            String segment = segments.get(i);
            validatePlaceholders(template, segment);
            if (buildIndex < 0 && (segment.contains(ResolvedPattern.DATE)
                    || segment.contains(ResolvedPattern.BUILD_NUMBER))) {
                buildIndex = i;
            }
        }
        if (buildIndex < 0) {
            throw new TemplateException("Template '" + template + "' has no {date}/{buildNumber} segment");
        }

        String buildTemplate = segments.get(buildIndex);
        if (occurrences(buildTemplate, ResolvedPattern.DATE) != 1
                || occurrences(buildTemplate, ResolvedPattern.BUILD_NUMBER) != 1) {
            throw new TemplateException("Template '" + template
                    + "' must contain {date} and {buildNumber} exactly once in the same path segment");
        }

        List<String> prefix = new ArrayList<>();
        for (String segment : segments.subList(0, buildIndex)) {
            prefix.add(substitute(template, segment, component, branch));
        }
        String buildSegment = substitute(template, buildTemplate, component, branch);
        List<String> trailing = new ArrayList<>();
        for (String segment : segments.subList(buildIndex + 1, segments.size())) {
            trailing.add(substitute(template, segment, component, branch));
        }

        return new ResolvedPattern(template, String.join("/", prefix), buildSegment,
                toMatcher(buildSegment), trailing);
    }

    // -- Helpers --

    private static void validatePlaceholders(String template, String segment) throws TemplateException {
        Matcher m = PLACEHOLDER.matcher(segment);
        while (m.find()) {
            if (!KNOWN.contains(m.group(1))) {
                throw new TemplateException("Unknown placeholder {" + m.group(1) + "} in template '" + template + "'");
            }
        }
        String rest = PLACEHOLDER.matcher(segment).replaceAll("");
        if (rest.indexOf('{') >= 0 || rest.indexOf('}') >= 0) {
            throw new TemplateException("Unbalanced brace in template '" + template + "'");
        }
    }

    /** Replaces every placeholder except {@code {date}} and {@code {buildNumber}}. */
    private static String substitute(String template, String segment, Component component, Branch branch)
            throws TemplateException {
        Matcher m = PLACEHOLDER.matcher(segment);
        StringBuilder out = new StringBuilder();
        while (m.find()) {
            String name = m.group(1);
            String value = switch (name) {
                case "date", "buildNumber" -> m.group();
                case "ProjectShortKey" -> require(template, name, component.projectShortKey());
                case "ProjectName" -> require(template, name, component.projectName());
                case "ComponentName" -> require(template, name, component.name());
                case "componentName" -> require(template, name, component.name()).toLowerCase(Locale.ROOT);
                case "branch" -> require(template, name, branch.pathSafeName());
                default -> throw new TemplateException("Unknown placeholder {" + name + "}");
            };
            m.appendReplacement(out, Matcher.quoteReplacement(value));
        }
        m.appendTail(out);
        return out.toString();
    }

    private static String require(String template, String placeholder, String value) throws TemplateException {
        if (value == null || value.isBlank()) {
            throw new TemplateException("Template '" + template + "' references {" + placeholder
                    + "} but no value is set");
        }
        return value;
    }

    private static Pattern toMatcher(String buildSegment) {
        StringBuilder regex = new StringBuilder("^");
        int pos = 0;
        while (pos < buildSegment.length()) {
            int date = buildSegment.indexOf(ResolvedPattern.DATE, pos);
            int number = buildSegment.indexOf(ResolvedPattern.BUILD_NUMBER, pos);
            int next = nearest(date, number);
            if (next < 0) {
                regex.append(Pattern.quote(buildSegment.substring(pos)));
                break;
            }
            if (next > pos) {
                regex.append(Pattern.quote(buildSegment.substring(pos, next)));
            }
            if (next == date) {
                regex.append("(?<date>\\d{8})");
                pos = next + ResolvedPattern.DATE.length();
            } else {
                regex.append("(?<number>\\d+)");
                pos = next + ResolvedPattern.BUILD_NUMBER.length();
            }
        }
        return Pattern.compile(regex.append('$').toString());
    }

    private static int nearest(int a, int b) {
        if (a < 0) return b;
        if (b < 0) return a;
        return Math.min(a, b);
    }

    private static int occurrences(String text, String token) {
        int count = 0;
        for (int i = text.indexOf(token); i >= 0; i = text.indexOf(token, i + token.length())) {
            count++;
        }
        return count;
    }

    private static String trimSlashes(String path) {
        int start = 0;
        int end = path.length();
        while (start < end && path.charAt(start) == '/') start++;
        while (end > start && path.charAt(end - 1) == '/') end--;
        return path.substring(start, end);
    }
}
