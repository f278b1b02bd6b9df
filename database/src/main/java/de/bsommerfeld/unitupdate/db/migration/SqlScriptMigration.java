package de.bsommerfeld.unitupdate.db.migration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link Migration} defined by plain SQL scripts.
 *
 * <p>
 * Two comment directives are recognized in the up script:
 * <ul>
 * <li>{@code -- version: 1.0.1} assigns the migration to a unit version</li>
 * <li>{@code -- notice: text} is reported after the migration ran</li>
 * </ul>
 *
 * @see MigrationDirectory
 */
public class SqlScriptMigration implements Migration {

    private static final Logger LOG = LoggerFactory.getLogger(SqlScriptMigration.class);
    private static final String VERSION_DIRECTIVE = "-- version:";
    private static final String NOTICE_DIRECTIVE = "-- notice:";

    private final String name;
    private final String upSql;
    private final String downSql;
    private final String version;
    private final List<String> notices;

    public SqlScriptMigration(String name, String upSql, String downSql) {
        this.name = name;
        this.upSql = upSql;
        this.downSql = downSql;

        String foundVersion = null;
        List<String> foundNotices = new ArrayList<>();
        for (String line : upSql.split("\\r?\\n")) {
            String trimmed = line.trim();
            if (trimmed.startsWith(VERSION_DIRECTIVE)) {
                foundVersion = trimmed.substring(VERSION_DIRECTIVE.length()).trim();
            } else if (trimmed.startsWith(NOTICE_DIRECTIVE)) {
                foundNotices.add(trimmed.substring(NOTICE_DIRECTIVE.length()).trim());
            }
        }
        this.version = foundVersion;
        this.notices = List.copyOf(foundNotices);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String version() {
        return version;
    }

    @Override
    public List<String> up(Connection connection) throws SQLException {
        executeScript(connection, upSql);
        return notices;
    }

    @Override
    public void down(Connection connection) throws SQLException {
        if (downSql == null) {
            LOG.warn("Migration {} has no down script, nothing to revert", name);
            return;
        }
        executeScript(connection, downSql);
    }

    private static void executeScript(Connection connection, String script) throws SQLException {
        try (Statement stmt = connection.createStatement()) {
            for (String sql : script.split(";\\s*(\\r?\\n|$)")) {
                String statement = stripComments(sql);
                if (statement.isEmpty())
                    continue;
                stmt.execute(statement);
            }
        }
    }

    private static String stripComments(String sql) {
        StringBuilder out = new StringBuilder();
        for (String line : sql.split("\\r?\\n")) {
            if (line.trim().startsWith("--"))
                continue;
            out.append(line).append('\n');
        }
        return out.toString().trim();
    }
}
