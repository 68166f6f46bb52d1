package net.seitter.heapstore.web;

import io.javalin.Javalin;
import io.javalin.json.JavalinJackson;
import net.seitter.heapstore.ObjectMappers;
import net.seitter.heapstore.StorageEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;

/**
 * Read-only JSON endpoints over the statistics of a running storage engine.
 */
public class StatsServer {
    private static final Logger logger = LoggerFactory.getLogger(StatsServer.class);

    private final StorageEngine engine;
    private final int port;
    private final Javalin app;
    private boolean running = false;

    /**
     * Creates a stats server; it does not listen until {@link #start()} is called.
     *
     * @param engine The engine to report on
     * @param port The port to listen on, 0 for any free port
     */
    public StatsServer(StorageEngine engine, int port) {
        this.engine = engine;
        this.port = port;

        app = Javalin.create(config -> {
            config.showJavalinBanner = false;
            config.jsonMapper(new JavalinJackson(ObjectMappers.create()));
        });

        configureRoutes();
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        app.start(port);
        running = true;
        logger.info("Stats server started on port {}", getPort());
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        app.stop();
        running = false;
        logger.info("Stats server stopped");
    }

    public synchronized boolean isRunning() {
        return running;
    }

    /**
     * Gets the port the server listens on, which differs from the configured one when that was 0.
     *
     * @return The port
     */
    public int getPort() {
        return running ? app.port() : port;
    }

    private void configureRoutes() {
        app.get("/api/status", ctx -> {
            Map<String, Object> status = new HashMap<>();
            status.put("status", "running");
            status.put("dataDir", engine.getConfig().getDataDir().toAbsolutePath().toString());
            status.put("pageSize", engine.getConfig().getPageSize());
            status.put("evictionPolicy", engine.getConfig().getEvictionPolicy());
            status.put("tables", engine.tableNames());
            status.put("openFiles", engine.getHandlePool().getHandles().size());
            ctx.json(status);
        });

        app.get("/api/bufferpools", ctx -> ctx.json(engine.getStatistics()));

        app.get("/api/bufferpools/evictions", ctx -> ctx.json(engine.getEvictionLog()));

        app.get("/api/indexes", ctx -> ctx.json(engine.getIndexRegistry().listIndexes(null)));

        app.get("/api/indexes/{table}", ctx ->
                ctx.json(engine.getIndexRegistry().listIndexes(ctx.pathParam("table"))));

        app.exception(Exception.class, (e, ctx) -> {
            logger.error("Error handling {}", ctx.path(), e);
            Map<String, Object> error = new HashMap<>();
            error.put("error", e.getMessage());
            ctx.status(500).json(error);
        });
    }
}
