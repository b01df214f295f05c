package com.finfocus.plugin.install;

import com.finfocus.common.infra.Semver;
import com.finfocus.plugin.RegistryException;
import com.finfocus.plugin.RegistryException.Kind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class PluginSpecifierTest {

    @Test
    void parse_registryName() {
        PluginSpecifier parsed = PluginSpecifier.parse("aws-public");

        assertEquals("aws-public", parsed.name());
        assertNull(parsed.owner());
        assertNull(parsed.repo());
        assertFalse(parsed.hasVersion());
        assertFalse(parsed.fromUrl());
    }

    @Test
    void parse_registryNameWithVersion() {
        PluginSpecifier parsed = PluginSpecifier.parse(" kubecost@v1.2.3 ");

        assertEquals("kubecost", parsed.name());
        assertEquals("v1.2.3", parsed.version());
        assertTrue(parsed.isExactVersion());
    }

    @Test
    void parse_latestMeansNoVersion() {
        assertFalse(PluginSpecifier.parse("kubecost@latest").hasVersion());
        assertFalse(PluginSpecifier.parse("acme/finfocus-plugin-x@LATEST").hasVersion());
    }

    @Test
    void parse_ownerRepoDerivesName() {
        PluginSpecifier parsed = PluginSpecifier.parse("acme/finfocus-plugin-gcp-billing@v0.4.0");

        assertEquals("gcp-billing", parsed.name());
        assertEquals("acme", parsed.owner());
        assertEquals("finfocus-plugin-gcp-billing", parsed.repo());
        assertEquals("v0.4.0", parsed.version());
        assertTrue(parsed.fromUrl());
    }

    @Test
    void parse_repoWithoutConventionalPrefixKeepsName() {
        assertEquals("cost-tool", PluginSpecifier.parse("acme/cost-tool").name());
        assertEquals("finfocus-plugin-", PluginSpecifier.parse("acme/finfocus-plugin-").name());
    }

    @Test
    void parse_githubUrls() {
        PluginSpecifier plain = PluginSpecifier.parse("github.com/acme/finfocus-plugin-x");
        PluginSpecifier https = PluginSpecifier.parse("https://github.com/acme/finfocus-plugin-x@v1.0.0");

        assertEquals("acme", plain.owner());
        assertEquals("x", plain.name());
        assertEquals("finfocus-plugin-x", https.repo());
        assertEquals("v1.0.0", https.version());
    }

    @Test
    void parse_constraintVersions() {
        PluginSpecifier caret = PluginSpecifier.parse("kubecost@^1.2");
        assertFalse(caret.isExactVersion());
        assertTrue(caret.constraint().check(Semver.parse("1.9.0")));

        PluginSpecifier range = PluginSpecifier.parse("acme/x@>=1.0.0,<2.0.0");
        assertEquals(">=1.0.0,<2.0.0", range.version());
        assertFalse(range.isExactVersion());

        assertFalse(PluginSpecifier.parse("kubecost@1.2").isExactVersion());
        assertTrue(PluginSpecifier.parse("kubecost@1.2.0-rc.1").isExactVersion());
    }

    @Test
    void parse_badConstraintIsInvalidConstraint() {
        RegistryException e = assertThrows(RegistryException.class,
                () -> PluginSpecifier.parse("kubecost@banana"));
        assertEquals(Kind.INVALID_CONSTRAINT, e.getKind());
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "", "   ", "/", "acme/", "/repo", "acme/repo/extra", "github.com/invalid",
            "kubecost@", "@v1.0.0", "../etc", "name with space", ".hidden"
    })
    void parse_rejectsMalformed(String input) {
        RegistryException e = assertThrows(RegistryException.class, () -> PluginSpecifier.parse(input));
        assertEquals(Kind.INVALID_SPECIFIER, e.getKind(), input);
    }

    @Test
    void parse_nullIsInvalid() {
        assertEquals(Kind.INVALID_SPECIFIER,
                assertThrows(RegistryException.class, () -> PluginSpecifier.parse(null)).getKind());
    }

    @Test
    void parseOwnerRepo_splitsAndValidates() {
        assertArrayEquals(new String[] { "owner", "repo" }, PluginSpecifier.parseOwnerRepo("owner/repo"));
        assertThrows(RegistryException.class, () -> PluginSpecifier.parseOwnerRepo("invalid"));
        assertThrows(RegistryException.class, () -> PluginSpecifier.parseOwnerRepo(""));
        assertThrows(RegistryException.class, () -> PluginSpecifier.parseOwnerRepo("/"));
    }
}
