package com.taskchat.storage;

import com.taskchat.models.NewTask;
import com.taskchat.models.Task;
import com.taskchat.models.TaskPriority;
import com.taskchat.models.TaskStatus;
import com.taskchat.models.TaskStatusFilter;
import com.taskchat.models.TaskUpdate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class SqliteTaskStoreTest {

    @TempDir
    Path tempDir;

    private SqliteTaskStore store;

    @BeforeEach
    void setUp() {
        SqliteDatabase database = new SqliteDatabase(tempDir.resolve("tasks.db"));
        database.initializeSchema();
        store = new SqliteTaskStore(database);
    }

    @Test
    void createdTaskIsPendingWithDefaultPriority() {
        Task task = store.createTask("u1", NewTask.titled("Buy milk"));

        assertNotNull(task.getId());
        assertEquals("Buy milk", task.getTitle());
        assertEquals(TaskStatus.PENDING, task.getStatus());
        assertEquals(TaskPriority.MEDIUM, task.getPriority());
        assertEquals("Buy milk", store.getTask("u1", task.getId()).orElseThrow().getTitle());
    }

    @Test
    void listIsNewestFirstAndFilteredByStatus() {
        Task first = store.createTask("u1", NewTask.titled("first"));
        Task second = store.createTask("u1", NewTask.titled("second"));
        Task third = store.createTask("u1", NewTask.titled("third"));
        store.completeTask("u1", second.getId());

        List<Task> all = store.listTasks("u1", TaskStatusFilter.ALL, 50, 0);
        assertEquals(List.of(third.getId(), second.getId(), first.getId()), ids(all));

        List<Task> pending = store.listTasks("u1", TaskStatusFilter.PENDING, 50, 0);
        assertEquals(List.of(third.getId(), first.getId()), ids(pending));
        assertEquals(1, store.countTasks("u1", TaskStatusFilter.COMPLETED));
        assertEquals(3, store.countTasks("u1", TaskStatusFilter.ALL));
    }

    @Test
    void listPagesWithLimitAndOffset() {
        for (int i = 0; i < 5; i++) {
            store.createTask("u1", NewTask.titled("task " + i));
        }
        List<Task> page = store.listTasks("u1", TaskStatusFilter.ALL, 2, 2);
        assertEquals(2, page.size());
        assertEquals("task 2", page.get(0).getTitle());
        assertEquals("task 1", page.get(1).getTitle());
    }

    @Test
    void repeatedListWithoutWritesIsIdentical() {
        for (int i = 0; i < 4; i++) {
            store.createTask("u1", NewTask.titled("task " + i));
        }
        List<String> first = ids(store.listTasks("u1", TaskStatusFilter.ALL, 50, 0));
        List<String> second = ids(store.listTasks("u1", TaskStatusFilter.ALL, 50, 0));
        assertEquals(first, second);
    }

    @Test
    void updateChangesOnlyGivenFieldsAndEmptyDescriptionClears() {
        Task task = store.createTask("u1", new NewTask("Write report", "draft first", TaskPriority.LOW, null));

        Task updated = store.updateTask("u1", task.getId(), new TaskUpdate().priority(TaskPriority.HIGH));
        assertEquals("Write report", updated.getTitle());
        assertEquals("draft first", updated.getDescription());
        assertEquals(TaskPriority.HIGH, updated.getPriority());
        assertTrue(updated.getUpdatedAt() > task.getUpdatedAt());

        Task cleared = store.updateTask("u1", task.getId(), new TaskUpdate().description(""));
        assertNull(cleared.getDescription());
        assertNull(store.getTask("u1", task.getId()).orElseThrow().getDescription());
    }

    @Test
    void completeIsIdempotent() {
        Task task = store.createTask("u1", NewTask.titled("Call mom"));
        Task completed = store.completeTask("u1", task.getId());
        Task again = store.completeTask("u1", task.getId());

        assertEquals(TaskStatus.COMPLETED, again.getStatus());
        assertEquals(completed.getUpdatedAt(), again.getUpdatedAt());
    }

    @Test
    void deleteRemovesTaskAndMissingIdIsNotFound() {
        Task task = store.createTask("u1", NewTask.titled("Temporary"));
        assertEquals(task.getId(), store.deleteTask("u1", task.getId()));
        assertTrue(store.getTask("u1", task.getId()).isEmpty());

        NotFoundException e = assertThrows(NotFoundException.class, () -> store.deleteTask("u1", task.getId()));
        assertEquals("Task", e.getEntity());
    }

    @Test
    void otherOwnerCannotSeeOrChangeTask() {
        Task task = store.createTask("u2", NewTask.titled("Private"));

        assertTrue(store.getTask("u1", task.getId()).isEmpty());
        assertThrows(NotFoundException.class, () -> store.completeTask("u1", task.getId()));
        assertThrows(NotFoundException.class,
            () -> store.updateTask("u1", task.getId(), new TaskUpdate().title("Hijacked")));
        assertThrows(NotFoundException.class, () -> store.deleteTask("u1", task.getId()));

        Task stored = store.getTask("u2", task.getId()).orElseThrow();
        assertEquals(TaskStatus.PENDING, stored.getStatus());
        assertEquals("Private", stored.getTitle());
    }

    @Test
    void blankOwnerIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> store.createTask(" ", NewTask.titled("x")));
        assertThrows(IllegalArgumentException.class, () -> store.listTasks(null, TaskStatusFilter.ALL, 10, 0));
    }

    @Test
    void concurrentCreatesAreAllPersistedWithDistinctIds() throws Exception {
        int count = 24;
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Task>> futures = new ArrayList<>();
            for (int i = 0; i < count; i++) {
                String title = "parallel " + i;
                futures.add(pool.submit(() -> {
                    start.await();
                    return store.createTask("u1", NewTask.titled(title));
                }));
            }
            start.countDown();

            Set<String> ids = new HashSet<>();
            for (Future<Task> future : futures) {
                ids.add(future.get(30, TimeUnit.SECONDS).getId());
            }
            assertEquals(count, ids.size());
            assertEquals(count, store.countTasks("u1", TaskStatusFilter.ALL));
        } finally {
            pool.shutdownNow();
        }
    }

    private static List<String> ids(List<Task> tasks) {
        List<String> ids = new ArrayList<>();
        for (Task task : tasks) {
            ids.add(task.getId());
        }
        return ids;
    }
}
