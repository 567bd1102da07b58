package minis;

import minis.db.MinisDatabase;

/**
 * What command handlers may touch: the store, the runtime config, and the counters.
 */
public interface ServerContext {
    MinisDatabase getDatabase();

    Config getConfig();

    // Clients
    int getActiveConnections();

    // Stats
    long getTotalCommandsProcessed();
}
