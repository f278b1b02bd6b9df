package de.bsommerfeld.unitupdate.core.notes;

/**
 * Line-oriented sink for human-readable progress notes, typically a console.
 */
@FunctionalInterface
public interface NoteWriter {

    void writeln(String line);
}
