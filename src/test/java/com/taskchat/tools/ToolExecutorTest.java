package com.taskchat.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskchat.models.NewTask;
import com.taskchat.models.Task;
import com.taskchat.models.TaskStatusFilter;
import com.taskchat.models.TaskUpdate;
import com.taskchat.storage.SqliteDatabase;
import com.taskchat.storage.SqliteTaskStore;
import com.taskchat.storage.StoreException;
import com.taskchat.storage.TaskStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ToolExecutorTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper mapper = new ObjectMapper();
    private SqliteTaskStore store;
    private ToolExecutor executor;

    @BeforeEach
    void setUp() {
        SqliteDatabase database = new SqliteDatabase(tempDir.resolve("tools.db"));
        database.initializeSchema();
        store = new SqliteTaskStore(database);
        executor = new ToolExecutor(TaskTools.createRegistry(store, mapper), mapper);
    }

    private JsonNode json(String text) throws Exception {
        return mapper.readTree(text);
    }

    @Test
    void catalogHasTheFiveTaskTools() {
        List<ToolDescriptor> catalog = executor.catalog();
        assertEquals(5, catalog.size());
        assertEquals(List.of("createTask", "listTasks", "completeTask", "updateTask", "deleteTask"),
            catalog.stream().map(ToolDescriptor::getName).collect(java.util.stream.Collectors.toList()));
    }

    @Test
    void createTaskPersistsForCallerOwner() throws Exception {
        ToolInvocationResult result = executor.execute("createTask",
            json("{\"title\":\"  Buy milk \",\"priority\":\"high\",\"dueDate\":\"2026-10-20\"}"), "u1");

        assertTrue(result.isSuccess());
        assertEquals("createTask", result.getTool());
        assertEquals("Buy milk", result.getResult().get("title").asText());
        assertEquals("high", result.getResult().get("priority").asText());
        assertEquals("2026-10-20T00:00:00Z", result.getResult().get("dueDate").asText());
        assertFalse(result.getResult().has("owner"));
        assertEquals(1, store.countTasks("u1", TaskStatusFilter.ALL));
    }

    @Test
    void unknownToolIsReportedNotThrown() throws Exception {
        ToolInvocationResult result = executor.execute("dropDatabase", json("{}"), "u1");
        assertFalse(result.isSuccess());
        assertEquals(ToolErrorKind.UNKNOWN_TOOL, result.getError().getKind());
    }

    @Test
    void snakeCaseToolNamesAndAliasesResolve() throws Exception {
        assertEquals("createTask", executor.execute("add_task", json("{\"title\":\"a\"}"), "u1").getTool());
        assertEquals("listTasks", executor.execute("list_tasks", json("{}"), "u1").getTool());
        assertTrue(executor.execute("LIST-TASKS", json("{}"), "u1").isSuccess());
    }

    @Test
    void invalidInputNeverReachesTheStore() throws Exception {
        CountingTaskStore counting = new CountingTaskStore(store);
        ToolExecutor guarded = new ToolExecutor(TaskTools.createRegistry(counting, mapper), mapper);

        ToolInvocationResult result = guarded.execute("createTask", json("{\"title\":\"\"}"), "u1");
        assertEquals(ToolErrorKind.VALIDATION_ERROR, result.getError().getKind());
        assertEquals("title must not be blank", result.getError().getMessage());

        result = guarded.execute("completeTask", json("{\"taskId\":\"not-a-uuid\"}"), "u1");
        assertEquals(ToolErrorKind.VALIDATION_ERROR, result.getError().getKind());

        result = guarded.execute("createTask", json("{\"title\":\"x\",\"owner\":\"u2\"}"), "u1");
        assertEquals(ToolErrorKind.VALIDATION_ERROR, result.getError().getKind());

        assertEquals(0, counting.calls.get());
    }

    @Test
    void updateWithoutAnyFieldIsValidationError() throws Exception {
        Task task = store.createTask("u1", NewTask.titled("a"));
        ToolInvocationResult result = executor.execute("updateTask",
            json("{\"taskId\":\"" + task.getId() + "\"}"), "u1");
        assertEquals(ToolErrorKind.VALIDATION_ERROR, result.getError().getKind());
    }

    @Test
    void updateAndCompleteReturnTheUpdatedTask() throws Exception {
        Task task = store.createTask("u1", NewTask.titled("draft"));
        ToolInvocationResult updated = executor.execute("updateTask",
            json("{\"task_id\":\"" + task.getId() + "\",\"title\":\"final\"}"), "u1");
        assertTrue(updated.isSuccess());
        assertEquals("final", updated.getResult().get("title").asText());

        ToolInvocationResult completed = executor.execute("completeTask",
            json("{\"taskId\":\"" + task.getId() + "\"}"), "u1");
        assertEquals("completed", completed.getResult().get("status").asText());
    }

    @Test
    void missingTaskIsNotFound() throws Exception {
        ToolInvocationResult result = executor.execute("completeTask",
            json("{\"taskId\":\"3f2b8c9e-5d1a-4c7b-9a8e-2f1d0c3b4a5e\"}"), "u1");
        assertEquals(ToolErrorKind.NOT_FOUND, result.getError().getKind());
    }

    @Test
    void listReturnsTasksWithCountAndTotal() throws Exception {
        for (int i = 0; i < 3; i++) {
            store.createTask("u1", NewTask.titled("t" + i));
        }
        ToolInvocationResult result = executor.execute("listTasks", json("{\"limit\":2}"), "u1");
        assertTrue(result.isSuccess());
        assertEquals(2, result.getResult().get("tasks").size());
        assertEquals(2, result.getResult().get("count").asInt());
        assertEquals(3, result.getResult().get("total").asInt());
        assertEquals("t2", result.getResult().get("tasks").get(0).get("title").asText());
    }

    @Test
    void deleteReturnsRemovedId() throws Exception {
        Task task = store.createTask("u1", NewTask.titled("gone"));
        ToolInvocationResult result = executor.execute("deleteTask",
            json("{\"taskId\":\"" + task.getId() + "\"}"), "u1");
        assertEquals(task.getId(), result.getResult().get("id").asText());
        assertTrue(store.getTask("u1", task.getId()).isEmpty());
    }

    @Test
    void storeFailureIsStoreErrorWithoutInternals() throws Exception {
        ToolExecutor broken = new ToolExecutor(TaskTools.createRegistry(new BrokenTaskStore(), mapper), mapper);
        ToolInvocationResult result = broken.execute("createTask", json("{\"title\":\"a\"}"), "u1");
        assertEquals(ToolErrorKind.STORE_ERROR, result.getError().getKind());
        assertFalse(result.getError().getMessage().contains("disk I/O"));
    }

    @Test
    void blankOwnerIsAProgrammingError() {
        assertThrows(IllegalArgumentException.class, () -> executor.execute("listTasks", null, " "));
    }

    private static final class CountingTaskStore implements TaskStore {
        private final TaskStore delegate;
        private final AtomicInteger calls = new AtomicInteger();

        CountingTaskStore(TaskStore delegate) {
            this.delegate = delegate;
        }

        @Override
        public Task createTask(String owner, NewTask task) {
            calls.incrementAndGet();
            return delegate.createTask(owner, task);
        }

        @Override
        public Optional<Task> getTask(String owner, String taskId) {
            calls.incrementAndGet();
            return delegate.getTask(owner, taskId);
        }

        @Override
        public List<Task> listTasks(String owner, TaskStatusFilter filter, int limit, int offset) {
            calls.incrementAndGet();
            return delegate.listTasks(owner, filter, limit, offset);
        }

        @Override
        public int countTasks(String owner, TaskStatusFilter filter) {
            calls.incrementAndGet();
            return delegate.countTasks(owner, filter);
        }

        @Override
        public Task updateTask(String owner, String taskId, TaskUpdate update) {
            calls.incrementAndGet();
            return delegate.updateTask(owner, taskId, update);
        }

        @Override
        public Task completeTask(String owner, String taskId) {
            calls.incrementAndGet();
            return delegate.completeTask(owner, taskId);
        }

        @Override
        public String deleteTask(String owner, String taskId) {
            calls.incrementAndGet();
            return delegate.deleteTask(owner, taskId);
        }
    }

    private static final class BrokenTaskStore implements TaskStore {
        private StoreException failure() {
            return new StoreException("disk I/O error", null);
        }

        @Override
        public Task createTask(String owner, NewTask task) {
            throw failure();
        }

        @Override
        public Optional<Task> getTask(String owner, String taskId) {
            throw failure();
        }

        @Override
        public List<Task> listTasks(String owner, TaskStatusFilter filter, int limit, int offset) {
            throw failure();
        }

        @Override
        public int countTasks(String owner, TaskStatusFilter filter) {
            throw failure();
        }

        @Override
        public Task updateTask(String owner, String taskId, TaskUpdate update) {
            throw failure();
        }

        @Override
        public Task completeTask(String owner, String taskId) {
            throw failure();
        }

        @Override
        public String deleteTask(String owner, String taskId) {
            throw failure();
        }
    }
}
