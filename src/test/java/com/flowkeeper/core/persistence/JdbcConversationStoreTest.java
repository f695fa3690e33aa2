package com.flowkeeper.core.persistence;

import com.flowkeeper.core.agent.ConversationMessage;
import com.flowkeeper.core.agent.MessageRole;
import com.flowkeeper.core.agent.ToolCall;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.flowkeeper.core.substrate.TestWorkflows.MAPPER;
import static org.junit.jupiter.api.Assertions.*;

class JdbcConversationStoreTest {

    private JdbcConversationStore store;

    @BeforeEach
    void setUp() throws Exception {
        store = new JdbcConversationStore(H2.dataSource(), MAPPER);
        store.createTables();
    }

    @Test
    @DisplayName("keeps messages in insertion order with tool call details")
    void savesAndLoads() {
        ToolCall call = new ToolCall("c1", "now", MAPPER.createObjectNode().put("timezone", "UTC"));
        List<ConversationMessage> messages = List.of(
                ConversationMessage.user("u1", "What time is it?", 1),
                ConversationMessage.assistant("a1", null, List.of(call), 2),
                ConversationMessage.tool("t1", "{\"time\":\"12:00\"}", call, 3));

        assertEquals(3, store.saveMessages("AG-1", messages));

        List<ConversationMessage> loaded = store.loadMessages("AG-1");
        assertEquals(List.of("u1", "a1", "t1"), loaded.stream().map(ConversationMessage::id).toList());
        assertEquals(MessageRole.ASSISTANT, loaded.get(1).role());
        assertEquals("UTC", loaded.get(1).toolCalls().get(0).arguments().path("timezone").asText());
        assertEquals("c1", loaded.get(2).toolCallId());
        assertEquals("now", loaded.get(2).toolName());
        assertEquals(3, loaded.get(2).timestamp());
    }

    @Test
    @DisplayName("messages already stored are skipped")
    void skipsKnownIds() {
        store.saveMessages("AG-2", List.of(ConversationMessage.user("u1", "hi", 1)));

        int written = store.saveMessages("AG-2", List.of(
                ConversationMessage.user("u1", "hi", 1),
                ConversationMessage.assistant("a1", "hello", null, 2),
                ConversationMessage.assistant("a1", "hello", null, 2)));

        assertEquals(1, written);
        assertEquals(2, store.loadMessages("AG-2").size());
    }

    @Test
    @DisplayName("conversations are kept per execution")
    void perExecution() {
        store.saveMessages("AG-3", List.of(ConversationMessage.user("u1", "one", 1)));
        store.saveMessages("AG-4", List.of(ConversationMessage.user("u1", "two", 1)));

        assertEquals("one", store.loadMessages("AG-3").get(0).content());
        assertEquals("two", store.loadMessages("AG-4").get(0).content());
        assertTrue(store.loadMessages("AG-5").isEmpty());
        assertEquals(0, store.saveMessages("AG-5", List.of()));
    }
}
