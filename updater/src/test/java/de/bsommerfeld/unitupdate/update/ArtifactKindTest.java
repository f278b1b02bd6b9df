package de.bsommerfeld.unitupdate.update;

import de.bsommerfeld.unitupdate.core.config.InstallationConfig;
import de.bsommerfeld.unitupdate.core.error.ExtractionFailedException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ArtifactKindTest {

    private static final List<String> ESCAPING = List.of(
            ".Evil", "Acme..Blog", "Acme.", "../x", "acme/blog", "acme\\blog", "..", "Acme.Blog/../../x");

    @TempDir
    Path tempDir;

    private InstallationConfig installation;

    @BeforeEach
    void setUp() {
        installation = new InstallationConfig();
        installation.setBaseDirectory(tempDir.toString());
    }

    // -- destination --

    @Test
    void destination_shouldMapPluginIdentifierToNestedDirectory() throws Exception {
        assertEquals(tempDir.resolve("plugins/acme/blog"),
                ArtifactKind.PLUGIN.destination(installation, "Acme.Blog"));
    }

    @Test
    void destination_shouldMapThemeIdentifierToDashedDirectory() throws Exception {
        assertEquals(tempDir.resolve("themes/acme-starter"),
                ArtifactKind.THEME.destination(installation, "Acme.Starter"));
    }

    @Test
    void destination_shouldKeepUnderscoresAndDashes() throws Exception {
        assertEquals(tempDir.resolve("plugins/my_vendor/blog-pro"),
                ArtifactKind.PLUGIN.destination(installation, "My_Vendor.Blog-Pro"));
    }

    @Test
    void destination_shouldUseBaseDirectoryForCore() throws Exception {
        assertEquals(installation.basePath(), ArtifactKind.CORE.destination(installation, "core"));
    }

    @Test
    void destination_shouldRejectEscapingPluginIdentifiers() {
        for (String identifier : ESCAPING) {
            assertThrows(ExtractionFailedException.class,
                    () -> ArtifactKind.PLUGIN.destination(installation, identifier), identifier);
        }
    }

    @Test
    void destination_shouldRejectEscapingThemeIdentifiers() {
        for (String identifier : ESCAPING) {
            assertThrows(ExtractionFailedException.class,
                    () -> ArtifactKind.THEME.destination(installation, identifier), identifier);
        }
    }

    @Test
    void destination_shouldRejectEmptyIdentifier() {
        ExtractionFailedException ex = assertThrows(ExtractionFailedException.class,
                () -> ArtifactKind.PLUGIN.destination(installation, ""));

        assertTrue(ex.getMessage().endsWith("empty identifier"), ex.getMessage());
        assertThrows(ExtractionFailedException.class, () -> ArtifactKind.THEME.destination(installation, null));
    }

    @Test
    void destination_shouldNameOffendingIdentifier() {
        ExtractionFailedException ex = assertThrows(ExtractionFailedException.class,
                () -> ArtifactKind.PLUGIN.destination(installation, ".Evil"));

        assertTrue(ex.getMessage().contains("'.Evil'"), ex.getMessage());
    }
}
