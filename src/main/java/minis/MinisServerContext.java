package minis;

import minis.db.MinisDatabase;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

public class MinisServerContext implements ServerContext {
    private final MinisDatabase db;
    private final Config config;

    private final AtomicInteger activeConnections = new AtomicInteger(0);
    private final AtomicLong totalCommands = new AtomicLong(0);

    public MinisServerContext(MinisDatabase db, Config config) {
        this.db = db;
        this.config = config;
    }

    @Override
    public MinisDatabase getDatabase() {
        return db;
    }

    @Override
    public Config getConfig() {
        return config;
    }

    @Override
    public int getActiveConnections() {
        return activeConnections.get();
    }

    @Override
    public long getTotalCommandsProcessed() {
        return totalCommands.get();
    }

    public void connectionOpened() {
        activeConnections.incrementAndGet();
    }

    public void connectionClosed() {
        activeConnections.decrementAndGet();
    }

    public void commandProcessed() {
        totalCommands.incrementAndGet();
    }
}
