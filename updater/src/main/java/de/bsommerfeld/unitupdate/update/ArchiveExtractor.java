package de.bsommerfeld.unitupdate.update;

import com.google.inject.Singleton;
import de.bsommerfeld.unitupdate.core.error.ExtractionFailedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Enumeration;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

/**
 * Unpacks downloaded zip archives. Existing files at the destination are
 * overwritten; files not contained in the archive are left alone.
 */
@Singleton
public class ArchiveExtractor {

    private static final Logger LOG = LoggerFactory.getLogger(ArchiveExtractor.class);

    /**
     * Extracts {@code archive} into {@code destination}, creating it if needed.
     *
     * @return number of files written
     * @throws ExtractionFailedException if the archive is unreadable or
     *                                   corrupt, an entry would escape the
     *                                   destination, or the destination is not
     *                                   writable
     */
    public int extract(Path archive, Path destination) throws ExtractionFailedException {
        Path root = destination.toAbsolutePath().normalize();
        int extracted = 0;

        try (ZipFile zip = new ZipFile(archive.toFile())) {
            Files.createDirectories(root);

            Enumeration<? extends ZipEntry> entries = zip.entries();
            while (entries.hasMoreElements()) {
                ZipEntry entry = entries.nextElement();

                // Normalize Windows backslashes written by some archivers
                String name = entry.getName().replace('\\', '/');
                Path target = root.resolve(name).normalize();
                if (!target.startsWith(root)) {
                    throw new ExtractionFailedException(archive, "entry escapes destination: " + name);
                }

                if (entry.isDirectory()) {
                    Files.createDirectories(target);
                    continue;
                }

                Files.createDirectories(target.getParent());
                try (InputStream in = zip.getInputStream(entry)) {
                    Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
                }
                extracted++;
            }
        } catch (IOException e) {
            throw new ExtractionFailedException(archive, e);
        }

        LOG.info("Extracted {} files from {} to {}", extracted, archive.getFileName(), root);
        return extracted;
    }
}
