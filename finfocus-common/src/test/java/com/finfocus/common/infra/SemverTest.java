package com.finfocus.common.infra;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SemverTest {

    // ascending precedence, one per line
    private static final List<String> ORDERED = List.of(
            "0.9.9",
            "1.0.0-alpha",
            "1.0.0-alpha.1",
            "1.0.0-alpha.beta",
            "1.0.0-beta",
            "1.0.0-beta.2",
            "1.0.0-beta.11",
            "1.0.0-rc.1",
            "1.0.0",
            "1.0.1",
            "1.2.0",
            "1.10.0",
            "2.0.0");

    // =========================================================================
    // Parsing
    // =========================================================================

    @Test
    void parse_full() {
        Semver.Version v = Semver.parse("v1.2.3-beta.1+build.5");
        assertEquals(1, v.major());
        assertEquals(2, v.minor());
        assertEquals(3, v.patch());
        assertEquals("beta.1", v.preRelease());
        assertEquals("build.5", v.build());
        assertEquals("v1.2.3-beta.1+build.5", v.toString());
        assertEquals("1.2.3-beta.1+build.5", v.canonical());
    }

    @Test
    void parse_coercesPartialVersions() {
        assertEquals("1.0.0", Semver.parse("1").canonical());
        assertEquals("1.2.0", Semver.parse("v1.2").canonical());
    }

    @Test
    void isValidVersion_acceptsAndRejects() {
        assertTrue(Semver.isValidVersion("1.0.0"));
        assertTrue(Semver.isValidVersion("v0.1.0-rc.1"));
        assertTrue(Semver.isValidVersion(" 2.0.0 "));

        assertFalse(Semver.isValidVersion("invalid"));
        assertFalse(Semver.isValidVersion("v1.2.0-!!invalid"));
        assertFalse(Semver.isValidVersion("1.2.3.4"));
        assertFalse(Semver.isValidVersion(""));
        assertFalse(Semver.isValidVersion(null));
        assertFalse(Semver.isValidVersion("99999999999999999999.0.0"));
    }

    // =========================================================================
    // Ordering
    // =========================================================================

    @Test
    void compareVersions_basic() {
        assertEquals(-1, Semver.compareVersions("1.0.0", "1.0.1"));
        assertEquals(0, Semver.compareVersions("v1.2.3", "1.2.3"));
        assertEquals(1, Semver.compareVersions("3.0.0", "2.9.9"));
        assertEquals(1, Semver.compareVersions("1.10.0", "1.9.0"));
    }

    @Test
    void compareVersions_preReleaseBelowRelease() {
        assertEquals(-1, Semver.compareVersions("1.0.0-alpha", "1.0.0"));
        assertEquals(1, Semver.compareVersions("1.0.0", "1.0.0-rc.1"));
    }

    @Test
    void compareVersions_ignoresBuildMetadata() {
        assertEquals(0, Semver.compareVersions("1.0.0+linux", "1.0.0+darwin"));
        assertEquals(Semver.parse("1.0.0+a"), Semver.parse("v1.0.0+b"));
    }

    @Test
    void compareVersions_invalidThrows() {
        assertThrows(Semver.SemverError.class, () -> Semver.compareVersions("abc", "1.0.0"));
        assertThrows(Semver.SemverError.class, () -> Semver.compareVersions("1.0.0", "v1.2.0-!!invalid"));
    }

    @Test
    void compareVersions_followsPrecedenceTable() {
        for (int i = 0; i < ORDERED.size(); i++) {
            for (int j = 0; j < ORDERED.size(); j++) {
                int expected = Integer.signum(Integer.compare(i, j));
                assertEquals(expected, Semver.compareVersions(ORDERED.get(i), ORDERED.get(j)),
                        ORDERED.get(i) + " vs " + ORDERED.get(j));
            }
        }
    }

    @Test
    void compareVersions_isAntisymmetric() {
        for (String a : ORDERED) {
            for (String b : ORDERED) {
                assertEquals(-Semver.compareVersions(b, a), Semver.compareVersions(a, b), a + " vs " + b);
            }
        }
    }

    // =========================================================================
    // Constraints
    // =========================================================================

    @Test
    void constraint_range() {
        Semver.Constraint c = Semver.parseVersionConstraint(">=1.0.0,<2.0.0");
        assertTrue(Semver.satisfiesConstraint("1.0.0", c));
        assertTrue(Semver.satisfiesConstraint("v1.5.3", c));
        assertFalse(Semver.satisfiesConstraint("2.0.0", c));
        assertFalse(Semver.satisfiesConstraint("0.9.0", c));
        assertEquals(">=1.0.0,<2.0.0", c.toString());
    }

    @Test
    void constraint_spacesBetweenOperatorAndVersion() {
        Semver.Constraint c = Semver.parseVersionConstraint(">= 1.2.0 < 1.4.0");
        assertTrue(Semver.satisfiesConstraint("1.3.9", c));
        assertFalse(Semver.satisfiesConstraint("1.4.0", c));
    }

    @Test
    void constraint_exact() {
        Semver.Constraint c = Semver.parseVersionConstraint("1.2.3");
        assertTrue(Semver.satisfiesConstraint("v1.2.3", c));
        assertFalse(Semver.satisfiesConstraint("1.2.4", c));

        Semver.Constraint ne = Semver.parseVersionConstraint("!=1.2.3");
        assertFalse(Semver.satisfiesConstraint("1.2.3", ne));
        assertTrue(Semver.satisfiesConstraint("1.2.4", ne));
    }

    @Test
    void constraint_tilde() {
        Semver.Constraint c = Semver.parseVersionConstraint("~1.2.3");
        assertTrue(Semver.satisfiesConstraint("1.2.3", c));
        assertTrue(Semver.satisfiesConstraint("1.2.9", c));
        assertFalse(Semver.satisfiesConstraint("1.3.0", c));
        assertFalse(Semver.satisfiesConstraint("1.2.2", c));

        Semver.Constraint major = Semver.parseVersionConstraint("~1");
        assertTrue(Semver.satisfiesConstraint("1.9.0", major));
        assertFalse(Semver.satisfiesConstraint("2.0.0", major));
    }

    @Test
    void constraint_caret() {
        Semver.Constraint c = Semver.parseVersionConstraint("^1.2.3");
        assertTrue(Semver.satisfiesConstraint("1.9.0", c));
        assertFalse(Semver.satisfiesConstraint("2.0.0", c));

        Semver.Constraint zeroMinor = Semver.parseVersionConstraint("^0.3.1");
        assertTrue(Semver.satisfiesConstraint("0.3.5", zeroMinor));
        assertFalse(Semver.satisfiesConstraint("0.4.0", zeroMinor));

        Semver.Constraint zeroPatch = Semver.parseVersionConstraint("^0.0.3");
        assertTrue(Semver.satisfiesConstraint("0.0.3", zeroPatch));
        assertFalse(Semver.satisfiesConstraint("0.0.4", zeroPatch));
    }

    @Test
    void constraint_wildcards() {
        Semver.Constraint x = Semver.parseVersionConstraint("1.x");
        assertTrue(Semver.satisfiesConstraint("1.0.0", x));
        assertTrue(Semver.satisfiesConstraint("1.99.1", x));
        assertFalse(Semver.satisfiesConstraint("2.0.0", x));

        Semver.Constraint star = Semver.parseVersionConstraint("1.2.*");
        assertTrue(Semver.satisfiesConstraint("1.2.7", star));
        assertFalse(Semver.satisfiesConstraint("1.3.0", star));

        assertTrue(Semver.satisfiesConstraint("42.0.0", Semver.parseVersionConstraint("*")));
    }

    @Test
    void constraint_partialComparisons() {
        assertTrue(Semver.satisfiesConstraint("1.3.0", Semver.parseVersionConstraint(">1.2")));
        assertFalse(Semver.satisfiesConstraint("1.2.9", Semver.parseVersionConstraint(">1.2")));
        assertTrue(Semver.satisfiesConstraint("1.2.9", Semver.parseVersionConstraint("<=1.2")));
        assertFalse(Semver.satisfiesConstraint("1.3.0", Semver.parseVersionConstraint("<=1.2")));
    }

    @Test
    void constraint_alternatives() {
        Semver.Constraint c = Semver.parseVersionConstraint("<1.0.0 || >=2.0.0");
        assertTrue(Semver.satisfiesConstraint("0.5.0", c));
        assertFalse(Semver.satisfiesConstraint("1.5.0", c));
        assertTrue(Semver.satisfiesConstraint("2.1.0", c));
    }

    @Test
    void constraint_hyphenRange() {
        Semver.Constraint c = Semver.parseVersionConstraint("1.1.0 - 1.3.0");
        assertTrue(Semver.satisfiesConstraint("1.1.0", c));
        assertTrue(Semver.satisfiesConstraint("1.3.0", c));
        assertFalse(Semver.satisfiesConstraint("1.3.1", c));
    }

    @Test
    void constraint_preReleaseOnlyWhenNamed() {
        Semver.Constraint plain = Semver.parseVersionConstraint(">=1.0.0");
        assertFalse(Semver.satisfiesConstraint("1.5.0-beta", plain));
        assertTrue(Semver.satisfiesConstraint("1.5.0", plain));

        Semver.Constraint withPre = Semver.parseVersionConstraint(">=1.0.0-alpha");
        assertTrue(Semver.satisfiesConstraint("1.0.0-beta", withPre));
        assertTrue(Semver.satisfiesConstraint("1.0.0", withPre));
    }

    @Test
    void parseVersionConstraint_rejectsGarbage() {
        assertThrows(Semver.SemverError.class, () -> Semver.parseVersionConstraint("not-a-version"));
        assertThrows(Semver.SemverError.class, () -> Semver.parseVersionConstraint(""));
        assertThrows(Semver.SemverError.class, () -> Semver.parseVersionConstraint(">=1.0.0 ||"));
        assertThrows(Semver.SemverError.class, () -> Semver.parseVersionConstraint(">=abc"));
    }

    @Test
    void satisfiesConstraint_invalidVersionThrows() {
        Semver.Constraint c = Semver.parseVersionConstraint(">=1.0.0");
        assertThrows(Semver.SemverError.class, () -> Semver.satisfiesConstraint("latest", c));
    }

    @Test
    void version_equalVersionsHashAlike() {
        Semver.Version padded = Semver.parse("1.0.0-01");
        Semver.Version plain = Semver.parse("v1.0.0-1");
        assertEquals(padded, plain);
        assertEquals(padded.hashCode(), plain.hashCode());

        Semver.Version withBuild = Semver.parse("1.0.0-rc.002+build.7");
        Semver.Version withoutBuild = Semver.parse("1.0.0-rc.2");
        assertEquals(withBuild, withoutBuild);
        assertEquals(withBuild.hashCode(), withoutBuild.hashCode());
        assertEquals(1, new HashSet<>(List.of(padded, plain)).size());
    }
}
