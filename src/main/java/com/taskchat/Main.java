package com.taskchat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskchat.auth.IdentityProvider;
import com.taskchat.auth.JwtIdentityProvider;
import com.taskchat.auth.UnauthorizedException;
import com.taskchat.chat.ChatOrchestrator;
import com.taskchat.chat.ErrorKind;
import com.taskchat.chat.TurnFailedException;
import com.taskchat.controllers.ChatController;
import com.taskchat.controllers.Controller;
import com.taskchat.controllers.HealthController;
import com.taskchat.controllers.TaskController;
import com.taskchat.reasoning.OpenAiReasoningEngine;
import com.taskchat.reasoning.ReasoningEngine;
import com.taskchat.storage.ConversationStore;
import com.taskchat.storage.ForbiddenException;
import com.taskchat.storage.NotFoundException;
import com.taskchat.storage.SqliteConversationStore;
import com.taskchat.storage.SqliteDatabase;
import com.taskchat.storage.SqliteTaskStore;
import com.taskchat.storage.StoreException;
import com.taskchat.storage.TaskStore;
import com.taskchat.tools.TaskTools;
import com.taskchat.tools.ToolExecutor;
import io.javalin.Javalin;
import io.javalin.json.JavalinJackson;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

public class Main {

    public static final String VERSION = "1.0.0";
    private static final ObjectMapper objectMapper = new ObjectMapper();
    private static AppLogger logger;

    public static void main(String[] args) {
        try {
            AppConfig config = new AppConfig.Builder()
                    .parseArgs(args)
                    .build();

            AppLogger.initialize(config.getLogPath(), config.isDevMode());
            logger = AppLogger.get();

            printBanner(config);

            if (config.getJwtSecret() == null) {
                throw new IllegalStateException("A JWT secret is required (--jwt-secret or TASKCHAT_JWT_SECRET)");
            }
            if (config.getReasoningApiKey() == null) {
                logger.warn("No TASKCHAT_REASONING_API_KEY set; reasoning requests will be sent without credentials");
            }

            SqliteDatabase database = new SqliteDatabase(config.getDatabasePath());
            database.initializeSchema();
            ConversationStore conversationStore = new SqliteConversationStore(database, objectMapper);
            TaskStore taskStore = new SqliteTaskStore(database);
            logger.info("Store ready: " + config.getDatabasePath());

            ToolExecutor toolExecutor = new ToolExecutor(TaskTools.createRegistry(taskStore, objectMapper), objectMapper);
            HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(config.getTurnSettings().getReasoningTimeoutMs()))
                .build();
            ReasoningEngine reasoningEngine = new OpenAiReasoningEngine(objectMapper, httpClient,
                config.getReasoningUrl(), config.getReasoningModel(), config.getReasoningApiKey(),
                config.getTurnSettings().getReasoningTimeoutMs());
            ExecutorService reasoningExecutor = Executors.newCachedThreadPool(daemonThreads("reasoning"));
            ChatOrchestrator orchestrator = new ChatOrchestrator(conversationStore, toolExecutor, reasoningEngine,
                config.getTurnSettings(), reasoningExecutor, objectMapper);
            logger.info("Orchestrator ready: " + config.getTurnSettings());

            IdentityProvider identityProvider = new JwtIdentityProvider(config.getJwtSecret());
            Javalin app = createApp(objectMapper, List.of(
                new HealthController(database, VERSION),
                new ChatController(identityProvider, orchestrator, conversationStore, objectMapper),
                new TaskController(identityProvider, toolExecutor, taskStore, objectMapper)
            ));

            app.start(config.getPort());

            String url = "http://localhost:" + config.getPort() + "/";
            logger.info("Server started on " + url);
            logger.console("");
            logger.console("  Listening on " + url);
            logger.console("  Database: " + config.getDatabasePath());
            logger.console("  Log file: " + config.getLogPath());
            logger.console("");
            logger.console("========================================");
            logger.console("  Press Ctrl+C to stop");
            logger.console("========================================");

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                logger.info("Shutting down...");
                app.stop();
                reasoningExecutor.shutdownNow();
                try {
                    reasoningExecutor.awaitTermination(2, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                logger.close();
            }));

        } catch (Exception e) {
            System.err.println("Failed to start Task Chat: " + e.getMessage());
            e.printStackTrace();
            System.exit(1);
        }
    }

    /**
     * Builds the HTTP app with the given controllers and the shared error mapping.
     * The app is not started.
     */
    public static Javalin createApp(ObjectMapper mapper, List<Controller> controllers) {
        Javalin app = Javalin.create(cfg -> {
            cfg.jsonMapper(new JavalinJackson(mapper));
            cfg.http.defaultContentType = "application/json";
        });
        for (Controller controller : controllers) {
            controller.registerRoutes(app);
        }
        registerExceptionHandlers(app);
        return app;
    }

    private static void printBanner(AppConfig config) {
        logger.console("");
        logger.console("========================================");
        logger.console("  Task Chat v" + VERSION);
        logger.console("========================================");
        logger.console("  Starting server...");
        if (config.isDevMode()) {
            logger.console("  Mode: Development");
        }
    }

    private static void registerExceptionHandlers(Javalin app) {
        app.exception(UnauthorizedException.class, (e, ctx) -> {
            AppLogger.get().warn("Unauthorized request to " + ctx.path() + ": " + e.getMessage());
            ctx.status(401).json(Controller.errorBody(ErrorKind.UNAUTHORIZED, "Authentication required"));
        });

        app.exception(TurnFailedException.class, (e, ctx) ->
            ctx.status(statusFor(e.getKind())).json(Controller.errorBody(e.getKind(), e.getDetail())));

        app.exception(NotFoundException.class, (e, ctx) ->
            ctx.status(404).json(Controller.errorBody(ErrorKind.NOT_FOUND, e.getEntity() + " not found")));

        // Foreign-owned rows are reported exactly like missing ones.
        app.exception(ForbiddenException.class, (e, ctx) ->
            ctx.status(404).json(Controller.errorBody(ErrorKind.NOT_FOUND, "Not found")));

        app.exception(StoreException.class, (e, ctx) -> {
            AppLogger.get().error("Store failure on " + ctx.path(), e);
            ctx.status(500).json(Controller.errorBody(ErrorKind.STORE_ERROR, "The request could not be completed"));
        });

        app.exception(Exception.class, (e, ctx) -> {
            AppLogger.get().error("Unhandled exception on " + ctx.path(), e);
            ctx.status(500).json(Controller.errorBody(ErrorKind.INTERNAL_ERROR, "Unexpected server error"));
        });
    }

    static int statusFor(ErrorKind kind) {
        switch (kind) {
            case VALIDATION_ERROR:
                return 400;
            case UNAUTHORIZED:
                return 401;
            case NOT_FOUND:
                return 404;
            case REASONING_TIMEOUT:
            case TURN_DEADLINE_EXCEEDED:
                return 504;
            case REASONING_UNAVAILABLE:
            case REASONING_RATE_LIMITED:
                return 503;
            default:
                return 500;
        }
    }

    private static java.util.concurrent.ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
