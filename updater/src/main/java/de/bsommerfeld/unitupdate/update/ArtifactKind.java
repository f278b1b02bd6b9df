package de.bsommerfeld.unitupdate.update;

import de.bsommerfeld.unitupdate.core.config.InstallationConfig;
import de.bsommerfeld.unitupdate.core.error.ExtractionFailedException;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Downloadable artifact categories with their gateway endpoint and
 * extraction target.
 */
public enum ArtifactKind {

    /** The application itself, unpacked over the base directory. */
    CORE("core/get") {
        @Override
        String fileCode(String identifier, String hash) {
            return "core";
        }

        @Override
        Map<String, Object> requestParams(String identifier) {
            return Map.of("type", "update");
        }

        @Override
        Path destination(InstallationConfig installation, String identifier) {
            return installation.basePath();
        }
    },

    /** {@code Acme.Blog} is unpacked to {@code plugins/acme/blog}. */
    PLUGIN("plugin/get") {
        @Override
        Map<String, Object> requestParams(String identifier) {
            Map<String, Object> params = new LinkedHashMap<>();
            params.put("name", identifier);
            params.put("installation", 0);
            return params;
        }

        @Override
        Path destination(InstallationConfig installation, String identifier) throws ExtractionFailedException {
            return resolveUnder(installation.pluginsPath(), identifier, "/");
        }
    },

    /** {@code Acme.Starter} is unpacked to {@code themes/acme-starter}. */
    THEME("theme/get") {
        @Override
        Map<String, Object> requestParams(String identifier) {
            return Map.of("name", identifier);
        }

        @Override
        Path destination(InstallationConfig installation, String identifier) throws ExtractionFailedException {
            return resolveUnder(installation.themesPath(), identifier, "-");
        }
    };

    private static final Pattern SEGMENT = Pattern.compile("[a-z0-9_-]+");

    private final String endpoint;

    ArtifactKind(String endpoint) {
        this.endpoint = endpoint;
    }

    public String endpoint() {
        return endpoint;
    }

    /** Identifies the download; distinct hashes of the same unit never share a file. */
    String fileCode(String identifier, String hash) {
        return identifier + hash;
    }

    abstract Map<String, Object> requestParams(String identifier);

    /**
     * Extraction target for {@code identifier}. Plugin and theme targets
     * always lie inside their root directory.
     *
     * @throws ExtractionFailedException if the identifier has an empty segment
     *                                   or characters outside
     *                                   {@code [A-Za-z0-9_-]}
     */
    abstract Path destination(InstallationConfig installation, String identifier)
            throws ExtractionFailedException;

    /**
     * Joins the lowercased dot-separated segments of {@code identifier} with
     * {@code separator} and resolves the result below {@code root}.
     */
    private static Path resolveUnder(Path root, String identifier, String separator)
            throws ExtractionFailedException {
        Path normalizedRoot = root.normalize();
        if (identifier == null || identifier.isEmpty())
            throw new ExtractionFailedException(normalizedRoot, "empty identifier");

        String[] segments = identifier.toLowerCase(Locale.ROOT).split("\\.", -1);
        for (String segment : segments) {
            if (!SEGMENT.matcher(segment).matches())
                throw new ExtractionFailedException(normalizedRoot, "invalid identifier '" + identifier + "'");
        }

        Path destination = normalizedRoot.resolve(String.join(separator, segments)).normalize();
        if (!destination.startsWith(normalizedRoot) || destination.equals(normalizedRoot))
            throw new ExtractionFailedException(normalizedRoot, "identifier '" + identifier + "' escapes the directory");
        return destination;
    }
}
