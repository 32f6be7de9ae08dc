package org.ifjc.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link ConfigLoader} to verify the configuration priority hierarchy:
 * <ol>
 *   <li>System Properties (highest priority)</li>
 *   <li>Configuration File</li>
 *   <li>Default reference configuration (lowest priority)</li>
 * </ol>
 */
@Tag("unit")
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty("test.value");
        System.clearProperty("ifjc.semantics.max-scope-depth");
        ConfigFactory.invalidateCaches();
    }

    @Test
    @DisplayName("loadDefaults should expose the reference values")
    void loadDefaults_shouldExposeReferenceValues() {
        Config config = ConfigLoader.loadDefaults();

        assertEquals(32, config.getInt("ifjc.semantics.max-scope-depth"));
        assertEquals("__", config.getString("ifjc.semantics.global-prefix"));
        assertFalse(config.getBoolean("ifjc.builtins.ext-boolthen"));
        assertEquals("PLAIN", config.getString("logging.format"));
    }

    @Test
    @DisplayName("loadFromFile should merge the file over the defaults")
    void loadFromFile_shouldMergeFileOverDefaults() throws URISyntaxException {
        Config config = ConfigLoader.loadFromFile(testResource("test-config.conf"));

        assertEquals(8, config.getInt("ifjc.semantics.max-scope-depth"));
        assertEquals("g_", config.getString("ifjc.semantics.global-prefix"));
        assertEquals(1021, config.getInt("ifjc.semantics.frame-capacity"));
        assertTrue(config.getBoolean("ifjc.builtins.ext-statican"));
        assertEquals("file-value", config.getString("test.value"));
    }

    @Test
    @DisplayName("System property should override file configuration")
    void loadFromFile_systemPropertyShouldOverrideFileConfig() throws URISyntaxException {
        System.setProperty("test.value", "system-value");
        System.setProperty("ifjc.semantics.max-scope-depth", "4");
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.loadFromFile(testResource("test-config.conf"));

        assertEquals("system-value", config.getString("test.value"));
        assertEquals(4, config.getInt("ifjc.semantics.max-scope-depth"));
        assertEquals("file-priority", config.getString("test.priority"));
    }

    @Test
    @DisplayName("Should resolve configuration references correctly")
    void loadFromFile_shouldResolveConfigurationReferences() throws URISyntaxException {
        Config config = ConfigLoader.loadFromFile(testResource("references-config.conf"));

        assertEquals("base-suffix", config.getString("test.referenced-value"));
    }

    @Test
    @DisplayName("resolve should use an explicit file and report it")
    void resolve_shouldUseExplicitFile() throws URISyntaxException {
        List<String> messages = new ArrayList<>();

        Config config = ConfigLoader.resolve(testResource("test-config.conf"),
                (level, message) -> messages.add(level + " " + message));

        assertEquals("g_", config.getString("ifjc.semantics.global-prefix"));
        assertEquals(1, messages.size());
        assertTrue(messages.get(0).startsWith("INFO Using configuration file"));
    }

    @Test
    @DisplayName("resolve should reject a missing explicit file")
    void resolve_shouldRejectMissingExplicitFile() {
        File missing = tempDir.resolve("missing.conf").toFile();

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> ConfigLoader.resolve(missing, (level, message) -> { }));
        assertTrue(e.getMessage().contains("missing.conf"));
    }

    @Test
    @DisplayName("resolve should fall back to the defaults without a config file")
    void resolve_shouldFallBackToDefaults() {
        List<ConfigLoader.MessageLevel> levels = new ArrayList<>();

        Config config = ConfigLoader.resolve(null, (level, message) -> levels.add(level));

        assertEquals(32, config.getInt("ifjc.semantics.max-scope-depth"));
        assertFalse(levels.isEmpty());
    }

    private static File testResource(String name) throws URISyntaxException {
        URL url = ConfigLoaderTest.class.getResource("/config/" + name);
        assertNotNull(url, "Missing test resource " + name);
        return new File(url.toURI());
    }
}
