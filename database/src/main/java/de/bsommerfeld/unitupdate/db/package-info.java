/**
 * SQLite persistence for the updater: parameters, installed unit versions and
 * the migration ledger.
 *
 * <h2>Tables</h2>
 *
 * <pre>
 * ┌───────────────────────────────────────────────────────────────────┐
 * │ system_parameters                                                 │
 * ├──────────────────┬────────────────────────────────────────────────┤
 * │ item  (PK)       │ e.g. "system::core.build"                      │
 * │ value            │ string, typed on read                          │
 * └──────────────────┴────────────────────────────────────────────────┘
 *
 * ┌───────────────────────────────────────────────────────────────────┐
 * │ unit_versions                                                     │
 * ├──────────────────┬────────────────────────────────────────────────┤
 * │ code  (PK)       │ plugin code, e.g. "Acme.Blog"                  │
 * │ version          │ currently applied version                      │
 * │ name, icon       │ display data                                   │
 * │ is_frozen        │ 1 = updates suppressed by the administrator    │
 * │ is_updatable     │ 0 = updates not permitted                      │
 * │ created_at       │ epoch seconds of first install                 │
 * └──────────────────┴────────────────────────────────────────────────┘
 *
 * ┌───────────────────────────────────────────────────────────────────┐
 * │ {migration-table} (configurable, default "migrations")            │
 * ├──────────────────┬────────────────────────────────────────────────┤
 * │ id  (PK, auto)   │ application order                              │
 * │ unit_path        │ migration path of the owning unit              │
 * │ migration        │ migration name, unique per unit_path           │
 * │ batch            │ apply invocation number                        │
 * └──────────────────┴────────────────────────────────────────────────┘
 * </pre>
 *
 * The first two tables are created from {@code schema.sql} at startup. The
 * ledger table is created on first install and dropped on uninstall, which
 * makes its existence the first-run signal.
 */
package de.bsommerfeld.unitupdate.db;
