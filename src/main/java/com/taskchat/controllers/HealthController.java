package com.taskchat.controllers;

import com.taskchat.AppLogger;
import com.taskchat.storage.SqliteDatabase;
import com.taskchat.storage.StoreException;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness endpoint. Needs no credentials.
 */
public class HealthController implements Controller {

    private final SqliteDatabase database;
    private final String version;
    private final AppLogger logger;

    public HealthController(SqliteDatabase database, String version) {
        this.database = database;
        this.version = version;
        this.logger = AppLogger.get();
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.get("/api/health", this::health);
    }

    private void health(Context ctx) {
        boolean databaseOk;
        try {
            databaseOk = database.read(connection -> connection.isValid(2));
        } catch (StoreException e) {
            logger.warn("[HealthController] Database check failed: " + e.getMessage());
            databaseOk = false;
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", databaseOk ? "ok" : "degraded");
        body.put("database", databaseOk ? "ok" : "unavailable");
        body.put("version", version);
        ctx.status(databaseOk ? 200 : 503).json(body);
    }
}
