package de.bsommerfeld.unitupdate.core.error;

import java.nio.file.Path;

/**
 * A downloaded archive could not be unpacked to its destination.
 */
public class ExtractionFailedException extends UpdateException {

    public ExtractionFailedException(Path archive, Throwable cause) {
        super("Unable to extract " + archive, cause);
    }

    public ExtractionFailedException(Path archive, String reason) {
        super("Unable to extract " + archive + ": " + reason);
    }
}
