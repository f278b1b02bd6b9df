package de.bsommerfeld.unitupdate.core.notes;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.inject.Singleton;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Gathers informational messages returned by migrations and seeders during a
 * run so they can be reported together at the end.
 *
 * <p>
 * Messages are grouped by their origin. Both the groups and the messages
 * within a group keep insertion order, which makes the printed report stable
 * across runs with the same input.
 */
@Singleton
public class NoticeCollector {

    private final Map<String, List<String>> notices = new LinkedHashMap<>();

    /** Records one message. Blank messages are dropped. */
    public synchronized void add(String origin, String message) {
        if (message == null || message.isBlank())
            return;
        notices.computeIfAbsent(origin, k -> new ArrayList<>()).add(message);
    }

    /** Records several messages for the same origin, skipping blanks. */
    public synchronized void addAll(String origin, List<String> messages) {
        if (messages == null)
            return;
        for (String message : messages) {
            add(origin, message);
        }
    }

    public synchronized boolean isEmpty() {
        return notices.isEmpty();
    }

    /** Returns an immutable copy of the collected notices. */
    public synchronized Map<String, List<String>> snapshot() {
        ImmutableMap.Builder<String, List<String>> copy = ImmutableMap.builder();
        notices.forEach((origin, messages) -> copy.put(origin, ImmutableList.copyOf(messages)));
        return copy.build();
    }

    /**
     * Writes the collected notices to {@code writer} and clears them.
     *
     * <pre>
     *
     * Acme\Blog\Updates\SeedTables reported:
     *  - Created 3 demo posts
     * </pre>
     */
    public synchronized void printTo(NoteWriter writer) {
        if (notices.isEmpty())
            return;

        if (writer != null) {
            writer.writeln("");
            notices.forEach((origin, messages) -> {
                writer.writeln(origin + " reported:");
                for (String message : messages) {
                    writer.writeln(" - " + message);
                }
            });
        }
        notices.clear();
    }

    public synchronized void clear() {
        notices.clear();
    }
}
