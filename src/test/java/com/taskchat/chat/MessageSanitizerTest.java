package com.taskchat.chat;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MessageSanitizerTest {

    @Test
    void trimsAndCollapsesWhitespace() {
        assertEquals("show my tasks", MessageSanitizer.sanitize("  show   my\t\ttasks  "));
        assertEquals("a\n\nb", MessageSanitizer.sanitize("a\r\n\r\n\r\n\r\nb"));
    }

    @Test
    void stripsMarkupThatCouldRunInABrowser() {
        String cleaned = MessageSanitizer.sanitize("add <script>alert(1)</script>task <b onclick=\"x()\">now</b>");
        assertFalse(cleaned.contains("script"));
        assertFalse(cleaned.contains("onclick"));
        assertTrue(cleaned.startsWith("add task"));
    }

    @Test
    void keepsPlainTextThatLooksLikeAttributes() {
        String message = "Add a task: gym Monday='leg day' and response=\"yes\"";
        assertEquals(message, MessageSanitizer.sanitize(message));
        assertEquals("meet at noon='12:00'", MessageSanitizer.sanitize("meet at noon='12:00'"));
    }

    @Test
    void stripsHandlersOnlyInsideTags() {
        String cleaned = MessageSanitizer.sanitize("<img src=\"a.png\" onerror='steal()'> on='kept'");
        assertFalse(cleaned.contains("onerror"));
        assertTrue(cleaned.endsWith("on='kept'"));
    }

    @Test
    void removesControlCharacters() {
        assertEquals("buy milk", MessageSanitizer.sanitize("buy\u0000 milk\u0007"));
    }

    @Test
    void rejectsEmptyAndOversizedInput() {
        TurnFailedException empty = assertThrows(TurnFailedException.class, () -> MessageSanitizer.sanitize("   "));
        assertEquals(ErrorKind.VALIDATION_ERROR, empty.getKind());
        assertEquals("Message cannot be empty", empty.getDetail());

        assertThrows(TurnFailedException.class, () -> MessageSanitizer.sanitize(null));

        String longMessage = "x".repeat(MessageSanitizer.MAX_MESSAGE_LENGTH + 1);
        TurnFailedException tooLong = assertThrows(TurnFailedException.class,
            () -> MessageSanitizer.sanitize(longMessage));
        assertEquals("Message exceeds max length of 2000 characters", tooLong.getDetail());
    }

    @Test
    void acceptsMessageAtMaxLength() {
        String message = "y".repeat(MessageSanitizer.MAX_MESSAGE_LENGTH);
        assertEquals(message, MessageSanitizer.sanitize(message));
    }

    @Test
    void rejectsMessageThatIsOnlyMarkup() {
        TurnFailedException e = assertThrows(TurnFailedException.class,
            () -> MessageSanitizer.sanitize("<script>steal()</script>"));
        assertEquals("Message has no readable content", e.getDetail());
    }

    @Test
    void titleIsFirstLineCut() {
        assertEquals("Groceries", MessageSanitizer.conversationTitle("Groceries\nmilk and eggs"));
        String title = MessageSanitizer.conversationTitle("z".repeat(200));
        assertEquals(MessageSanitizer.MAX_TITLE_LENGTH, title.length());
        assertNull(MessageSanitizer.conversationTitle(" "));
    }
}
