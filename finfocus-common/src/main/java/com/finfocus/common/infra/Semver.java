package com.finfocus.common.infra;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Semantic version parsing, comparison and constraint matching.
 * <p>
 * Tolerances: an optional {@code v} prefix is stripped; partial versions
 * ({@code 1}, {@code 1.2}) are coerced to full triples; pre-release versions
 * sort below their release ({@code 1.0.0-alpha < 1.0.0}); build metadata is
 * ignored for ordering.
 */
public final class Semver {

    private Semver() {
    }

    private static final String IDENTS = "[0-9A-Za-z-]+(?:\\.[0-9A-Za-z-]+)*";

    private static final Pattern VERSION_PATTERN = Pattern.compile(
            "^v?(\\d+)(?:\\.(\\d+))?(?:\\.(\\d+))?(?:-(" + IDENTS + "))?(?:\\+(" + IDENTS + "))?$");

    private static final Pattern RANGE_PATTERN = Pattern.compile(
            "^v?(\\d+|[xX*])(?:\\.(\\d+|[xX*]))?(?:\\.(\\d+|[xX*]))?(?:-(" + IDENTS + "))?(?:\\+(" + IDENTS + "))?$");

    private static final Pattern TERM_PATTERN = Pattern.compile("^(!=|>=|<=|=>|=<|~>|>|<|=|~|\\^)?(.+)$");

    private static final Pattern HYPHEN_RANGE = Pattern.compile("^\\s*(\\S+)\\s+-\\s+(\\S+)\\s*$");

    // =========================================================================
    // Errors
    // =========================================================================

    public static class SemverError extends IllegalArgumentException {
        public SemverError(String message) {
            super(message);
        }
    }

    // =========================================================================
    // Version
    // =========================================================================

    /**
     * A parsed version. {@code original} keeps the caller's spelling.
     */
    public record Version(long major, long minor, long patch, String preRelease, String build, String original)
            implements Comparable<Version> {

        public boolean isPreRelease() {
            return preRelease != null;
        }

        @Override
        public int compareTo(Version other) {
            int c = Long.compare(major, other.major);
            if (c != 0)
                return c;
            c = Long.compare(minor, other.minor);
            if (c != 0)
                return c;
            c = Long.compare(patch, other.patch);
            if (c != 0)
                return c;
            return comparePreRelease(preRelease, other.preRelease);
        }

        public boolean greaterThan(Version other) {
            return compareTo(other) > 0;
        }

        /**
         * Canonical {@code major.minor.patch[-pre][+build]} form.
         */
        public String canonical() {
            StringBuilder sb = new StringBuilder();
            sb.append(major).append('.').append(minor).append('.').append(patch);
            if (preRelease != null)
                sb.append('-').append(preRelease);
            if (build != null)
                sb.append('+').append(build);
            return sb.toString();
        }

        @Override
        public boolean equals(Object o) {
            if (this == o)
                return true;
            if (!(o instanceof Version v))
                return false;
            return compareTo(v) == 0;
        }

        /**
         * Consistent with {@link #equals}: numeric pre-release identifiers
         * hash without leading zeros and build metadata is ignored.
         */
        @Override
        public int hashCode() {
            return Objects.hash(major, minor, patch, normalizedPreRelease(preRelease));
        }

        @Override
        public String toString() {
            return original;
        }
    }

    /**
     * Parse a version string.
     *
     * @throws SemverError if the string is not a (coercible) semantic version
     */
    public static Version parse(String version) {
        if (version == null || version.isBlank()) {
            throw new SemverError("empty version");
        }
        String trimmed = version.trim();
        Matcher m = VERSION_PATTERN.matcher(trimmed);
        if (!m.matches()) {
            throw new SemverError("invalid semantic version: " + version);
        }
        try {
            return new Version(
                    Long.parseLong(m.group(1)),
                    m.group(2) != null ? Long.parseLong(m.group(2)) : 0,
                    m.group(3) != null ? Long.parseLong(m.group(3)) : 0,
                    m.group(4),
                    m.group(5),
                    trimmed);
        } catch (NumberFormatException e) {
            throw new SemverError("version component out of range: " + version);
        }
    }

    public static boolean isValidVersion(String version) {
        try {
            parse(version);
            return true;
        } catch (SemverError e) {
            return false;
        }
    }

    /**
     * Compare two version strings.
     *
     * @return -1, 0 or 1
     * @throws SemverError if either side is invalid
     */
    public static int compareVersions(String a, String b) {
        return Integer.signum(parse(a).compareTo(parse(b)));
    }

    static int comparePreRelease(String a, String b) {
        if (Objects.equals(a, b))
            return 0;
        if (a == null)
            return 1;
        if (b == null)
            return -1;
        String[] left = a.split("\\.");
        String[] right = b.split("\\.");
        for (int i = 0; i < Math.min(left.length, right.length); i++) {
            int c = compareIdentifier(left[i], right[i]);
            if (c != 0)
                return c;
        }
        return Integer.compare(left.length, right.length);
    }

    private static int compareIdentifier(String a, String b) {
        boolean aNum = a.chars().allMatch(Character::isDigit);
        boolean bNum = b.chars().allMatch(Character::isDigit);
        if (aNum && bNum) {
            int byLength = Integer.compare(stripZeros(a).length(), stripZeros(b).length());
            return byLength != 0 ? byLength : stripZeros(a).compareTo(stripZeros(b));
        }
        if (aNum)
            return -1;
        if (bNum)
            return 1;
        return a.compareTo(b);
    }

    private static String normalizedPreRelease(String preRelease) {
        if (preRelease == null) {
            return null;
        }
        String[] parts = preRelease.split("\\.");
        for (int i = 0; i < parts.length; i++) {
            if (parts[i].chars().allMatch(Character::isDigit)) {
                parts[i] = stripZeros(parts[i]);
            }
        }
        return String.join(".", parts);
    }

    private static String stripZeros(String digits) {
        String s = digits.replaceFirst("^0+", "");
        return s.isEmpty() ? "0" : s;
    }

    // =========================================================================
    // Constraints
    // =========================================================================

    /**
     * A parsed constraint: alternatives separated by {@code ||}, each a
     * conjunction of comparison terms.
     */
    public static final class Constraint {
        private final String expression;
        private final List<List<Term>> alternatives;

        private Constraint(String expression, List<List<Term>> alternatives) {
            this.expression = expression;
            this.alternatives = alternatives;
        }

        public boolean check(Version version) {
            for (List<Term> terms : alternatives) {
                if (matchesAll(terms, version)) {
                    return true;
                }
            }
            return false;
        }

        private static boolean matchesAll(List<Term> terms, Version version) {
            // a pre-release only matches when the constraint names one
            if (version.isPreRelease() && terms.stream().noneMatch(Term::preRelease)) {
                return false;
            }
            return terms.stream().allMatch(t -> t.test().test(version));
        }

        @Override
        public String toString() {
            return expression;
        }
    }

    private record Term(Predicate<Version> test, boolean preRelease) {
    }

    /**
     * Parse a constraint expression such as {@code >=1.0.0,<2.0.0},
     * {@code ~1.2}, {@code ^0.3.1}, {@code 1.x} or {@code 1.0 - 1.4}.
     *
     * @throws SemverError if empty or unparsable
     */
    public static Constraint parseVersionConstraint(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new SemverError("empty version constraint");
        }
        List<List<Term>> alternatives = new ArrayList<>();
        for (String alternative : expression.split("\\|\\|", -1)) {
            alternatives.add(parseConjunction(alternative, expression));
        }
        return new Constraint(expression.trim(), alternatives);
    }

    /**
     * @throws SemverError if {@code version} is not a valid version
     */
    public static boolean satisfiesConstraint(String version, Constraint constraint) {
        return constraint.check(parse(version));
    }

    private static List<Term> parseConjunction(String raw, String expression) {
        Matcher hyphen = HYPHEN_RANGE.matcher(raw);
        String normalized = hyphen.matches()
                ? ">=" + hyphen.group(1) + " <=" + hyphen.group(2)
                : raw;
        normalized = normalized.replaceAll("(!=|>=|<=|=>|=<|~>|>|<|=|~|\\^)\\s+", "$1").trim();
        if (normalized.isEmpty()) {
            throw new SemverError("empty term in version constraint: " + expression);
        }
        List<Term> terms = new ArrayList<>();
        for (String token : normalized.split("[,\\s]+")) {
            if (!token.isEmpty()) {
                terms.add(parseTerm(token, expression));
            }
        }
        return terms;
    }

    private static Term parseTerm(String token, String expression) {
        Matcher tm = TERM_PATTERN.matcher(token);
        if (!tm.matches()) {
            throw new SemverError("invalid version constraint: " + expression);
        }
        String op = tm.group(1) == null ? "=" : tm.group(1);
        Matcher vm = RANGE_PATTERN.matcher(tm.group(2));
        if (!vm.matches()) {
            throw new SemverError("invalid version constraint: " + expression);
        }

        long[] parts = new long[3];
        int specified = 0;
        for (int i = 0; i < 3; i++) {
            String g = vm.group(i + 1);
            if (g == null || isWildcard(g)) {
                break;
            }
            try {
                parts[i] = Long.parseLong(g);
            } catch (NumberFormatException e) {
                throw new SemverError("version component out of range in constraint: " + expression);
            }
            specified++;
        }
        String pre = vm.group(4);
        Version base = new Version(parts[0], parts[1], parts[2], specified == 3 ? pre : null, null, tm.group(2));
        boolean hasPre = base.isPreRelease();

        if (specified == 0) {
            return new Term(v -> true, false);
        }
        Version upper = specified == 1
                ? new Version(parts[0] + 1, 0, 0, null, null, "")
                : new Version(parts[0], parts[1] + 1, 0, null, null, "");
        boolean exact = specified == 3;

        Predicate<Version> test = switch (op) {
            case "=" -> exact ? v -> v.compareTo(base) == 0 : inRange(base, upper);
            case "!=" -> exact ? v -> v.compareTo(base) != 0 : inRange(base, upper).negate();
            case ">" -> exact ? v -> v.compareTo(base) > 0 : v -> v.compareTo(upper) >= 0;
            case ">=", "=>" -> v -> v.compareTo(base) >= 0;
            case "<" -> v -> v.compareTo(base) < 0;
            case "<=", "=<" -> exact ? v -> v.compareTo(base) <= 0 : v -> v.compareTo(upper) < 0;
            case "~", "~>" -> inRange(base, tildeUpper(parts, specified));
            case "^" -> inRange(base, caretUpper(parts, specified));
            default -> throw new SemverError("unknown operator " + op + " in constraint: " + expression);
        };
        return new Term(test, hasPre);
    }

    private static Predicate<Version> inRange(Version lowerInclusive, Version upperExclusive) {
        return v -> v.compareTo(lowerInclusive) >= 0 && v.compareTo(upperExclusive) < 0;
    }

    private static Version tildeUpper(long[] parts, int specified) {
        if (specified == 1) {
            return new Version(parts[0] + 1, 0, 0, null, null, "");
        }
        return new Version(parts[0], parts[1] + 1, 0, null, null, "");
    }

    private static Version caretUpper(long[] parts, int specified) {
        if (parts[0] > 0 || specified == 1) {
            return new Version(parts[0] + 1, 0, 0, null, null, "");
        }
        if (parts[1] > 0 || specified == 2) {
            return new Version(0, parts[1] + 1, 0, null, null, "");
        }
        return new Version(0, 0, parts[2] + 1, null, null, "");
    }

    private static boolean isWildcard(String part) {
        return "x".equalsIgnoreCase(part) || "*".equals(part);
    }
}
