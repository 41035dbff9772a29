package com.taskchat.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.taskchat.models.Conversation;
import com.taskchat.models.MessageRole;
import com.taskchat.models.NewTask;
import com.taskchat.models.Task;
import com.taskchat.models.TaskStatus;
import com.taskchat.models.TaskStatusFilter;
import com.taskchat.models.TaskUpdate;
import com.taskchat.storage.ForbiddenException;
import com.taskchat.storage.NotFoundException;
import com.taskchat.storage.SqliteConversationStore;
import com.taskchat.storage.SqliteDatabase;
import com.taskchat.storage.SqliteTaskStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class OwnerIsolationPropertyTest {

    private static final String[] OWNERS = {"alice", "bob", "carol", "dave"};
    private static final int ROUNDS = 120;

    @TempDir
    Path tempDir;

    @Test
    void noOperationByOneOwnerReachesAnotherOwnersData() {
        ObjectMapper mapper = new ObjectMapper();
        SqliteDatabase database = new SqliteDatabase(tempDir.resolve("isolation.db"));
        database.initializeSchema();
        SqliteTaskStore taskStore = new SqliteTaskStore(database);
        SqliteConversationStore conversationStore = new SqliteConversationStore(database, mapper);
        ToolExecutor executor = new ToolExecutor(TaskTools.createRegistry(taskStore, mapper), mapper);
        Random random = new Random(20260101L);

        for (int round = 0; round < ROUNDS; round++) {
            String victim = OWNERS[random.nextInt(OWNERS.length)];
            String attacker;
            do {
                attacker = OWNERS[random.nextInt(OWNERS.length)];
            } while (attacker.equals(victim));

            Task task = taskStore.createTask(victim, NewTask.titled("secret " + round));
            Conversation conversation = conversationStore.createConversation(victim, "private " + round);
            conversationStore.appendMessage(victim, conversation.getId(), MessageRole.USER, "hello", null);

            String context = "round " + round + " (" + attacker + " -> " + victim + ")";
            attempt(random.nextInt(10), attacker, task, conversation, taskStore, conversationStore, executor,
                mapper, context);

            Task after = taskStore.getTask(victim, task.getId()).orElseThrow();
            assertEquals(TaskStatus.PENDING, after.getStatus(), context);
            assertEquals("secret " + round, after.getTitle(), context);
            assertEquals(1, conversationStore.listRecentMessages(victim, conversation.getId(), 10).size(), context);
        }
    }

    private void attempt(int operation, String attacker, Task task, Conversation conversation,
                         SqliteTaskStore taskStore, SqliteConversationStore conversationStore,
                         ToolExecutor executor, ObjectMapper mapper, String context) {
        ObjectNode byId = mapper.createObjectNode().put("taskId", task.getId());
        switch (operation) {
            case 0:
                assertTrue(taskStore.getTask(attacker, task.getId()).isEmpty(), context);
                break;
            case 1:
                assertThrows(NotFoundException.class, () -> taskStore.completeTask(attacker, task.getId()), context);
                break;
            case 2:
                assertThrows(NotFoundException.class,
                    () -> taskStore.updateTask(attacker, task.getId(), new TaskUpdate().title("pwned")), context);
                break;
            case 3:
                assertThrows(NotFoundException.class, () -> taskStore.deleteTask(attacker, task.getId()), context);
                break;
            case 4:
                assertEquals(ToolErrorKind.NOT_FOUND,
                    executor.execute("completeTask", byId, attacker).getError().getKind(), context);
                break;
            case 5:
                assertEquals(ToolErrorKind.NOT_FOUND,
                    executor.execute("updateTask", byId.deepCopy().put("title", "pwned"), attacker)
                        .getError().getKind(), context);
                break;
            case 6:
                assertEquals(ToolErrorKind.NOT_FOUND,
                    executor.execute("deleteTask", byId, attacker).getError().getKind(), context);
                break;
            case 7:
                List<Task> visible = taskStore.listTasks(attacker, TaskStatusFilter.ALL, 100, 0);
                assertTrue(visible.stream().noneMatch(t -> t.getId().equals(task.getId())), context);
                break;
            case 8:
                assertThrows(ForbiddenException.class, () -> conversationStore.appendMessage(
                    attacker, conversation.getId(), MessageRole.USER, "injected", null), context);
                break;
            default:
                assertTrue(conversationStore.getConversation(attacker, conversation.getId()).isEmpty(), context);
                assertThrows(NotFoundException.class,
                    () -> conversationStore.listRecentMessages(attacker, conversation.getId(), 10), context);
                break;
        }
    }
}
