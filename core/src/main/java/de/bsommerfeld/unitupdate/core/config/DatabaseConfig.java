package de.bsommerfeld.unitupdate.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;

/**
 * Where the SQLite database lives and what the migration ledger table is called.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class DatabaseConfig {

    @JsonProperty("file")
    @JsonPropertyDescription("Path of the SQLite database file. Empty means the app data directory.")
    private String file;

    @JsonProperty("migration-table")
    @JsonPropertyDescription("Name of the migration ledger table (default: 'migrations')")
    private String migrationTable = "migrations";

    public String getFile() {
        return file;
    }

    public void setFile(String file) {
        this.file = file;
    }

    public String getMigrationTable() {
        return migrationTable;
    }

    public void setMigrationTable(String migrationTable) {
        this.migrationTable = migrationTable;
    }
}
