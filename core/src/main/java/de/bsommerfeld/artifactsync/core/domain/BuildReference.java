package de.bsommerfeld.artifactsync.core.domain;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Comparator;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Comparison key of a remote build: the build date and the build number of
 * that day.
 *
 * <p>
 * This is the only place where "which build is newer" is decided. Candidate
 * selection, the ledger's monotonic commit guard and retention eviction all
 * go through {@link #compareTo(BuildReference)} or
 * {@link #isNewerThan(BuildReference)}.
 *
 * <h3>Ordering</h3>
 * A reference is newer than another if its date is later, or if both dates
 * are equal and its build number is higher. The natural order is ascending
 * (oldest first).
 *
 * @param buildDate   day the build was produced
 * @param buildNumber sequence number within that day, never negative
 */
public record BuildReference(LocalDate buildDate, int buildNumber) implements Comparable<BuildReference> {

    /** Date rendering used in repository paths, e.g. {@code 20250102}. */
    public static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.BASIC_ISO_DATE;

    private static final Comparator<BuildReference> ORDER = Comparator
            .comparing(BuildReference::buildDate)
            .thenComparingInt(BuildReference::buildNumber);

    private static final Pattern FOLDER = Pattern.compile("^Build(\\d{8})\\.(\\d+)$");

    public BuildReference {
        Objects.requireNonNull(buildDate, "buildDate");
        if (buildNumber < 0) {
            throw new IllegalArgumentException("buildNumber must be >= 0, got " + buildNumber);
        }
    }

    public static BuildReference of(LocalDate date, int number) {
        return new BuildReference(date, number);
    }

    /**
     * Parses the canonical folder name {@code Build<yyyyMMdd>.<n>}. Returns
     * empty for anything else, including impossible calendar dates.
     */
    public static Optional<BuildReference> parseFolder(String folderName) {
        if (folderName == null) return Optional.empty();
        Matcher m = FOLDER.matcher(folderName);
        if (!m.matches()) return Optional.empty();
        return parse(m.group(1), m.group(2));
    }

    /**
     * Builds a reference from the raw date and number text captured out of a
     * repository path. Returns empty when either part is malformed.
     */
    public static Optional<BuildReference> parse(String dateText, String numberText) {
        try {
            LocalDate date = LocalDate.parse(dateText, DATE_FORMAT);
            int number = Integer.parseInt(numberText);
            if (number < 0) return Optional.empty();
            return Optional.of(new BuildReference(date, number));
        } catch (DateTimeParseException | NumberFormatException e) {
            return Optional.empty();
        }
    }

    /** Returns {@code true} if this build is strictly newer than {@code other}. */
    public boolean isNewerThan(BuildReference other) {
        return other == null || compareTo(other) > 0;
    }

    @Override
    public int compareTo(BuildReference other) {
        return ORDER.compare(this, other);
    }

    /** Date formatted for repository paths ({@code yyyyMMdd}). */
    public String formattedDate() {
        return buildDate.format(DATE_FORMAT);
    }

    /** Canonical folder name, e.g. {@code Build20250102.1}. */
    public String folderName() {
        return "Build" + formattedDate() + "." + buildNumber;
    }

    @Override
    public String toString() {
        return folderName();
    }
}
