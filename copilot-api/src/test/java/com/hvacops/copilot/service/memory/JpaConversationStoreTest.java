package com.hvacops.copilot.service.memory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hvacops.copilot.model.ChatMessage;
import com.hvacops.copilot.model.ChatRole;
import com.hvacops.copilot.model.Citation;
import com.hvacops.copilot.model.Evidence;
import com.hvacops.copilot.persistence.entity.CopilotMessageEntity;
import com.hvacops.copilot.persistence.repository.CopilotMessageRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class JpaConversationStoreTest {

    @Autowired
    private JpaConversationStore conversationStore;

    @Autowired
    private CopilotMessageRepository messageRepository;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    void storesExchangeWithMetadataAndHash() throws Exception {
        String jobId = "job-" + UUID.randomUUID();
        String conversationId = conversationStore.recordExchange(exchange(null, jobId, "Why the rattle?", "Tighten the mount."));

        assertThat(conversationId).isNotBlank();
        List<CopilotMessageEntity> stored = messageRepository.findByConversationIdOrderBySequenceAsc(conversationId);
        assertThat(stored).extracting(CopilotMessageEntity::getRole).containsExactly(ChatRole.USER, ChatRole.ASSISTANT);
        assertThat(stored).extracting(CopilotMessageEntity::getSource).containsOnly("app");
        assertThat(stored).extracting(CopilotMessageEntity::getModel).containsOnly("gpt-4o");
        assertThat(stored).extracting(CopilotMessageEntity::getPromptVersion).containsOnly("copilot.v1");
        assertThat(stored.get(1).getContentHash())
                .hasSize(64)
                .isEqualTo(JpaConversationStore.sha256("Tighten the mount."));

        JsonNode metadata = objectMapper.readTree(stored.get(1).getMetadataJson());
        assertThat(metadata.path("type").asText()).isEqualTo("assistant_message");
        assertThat(metadata.path("citations").get(0).path("doc_id").asText()).isEqualTo("note_1");
        assertThat(metadata.path("follow_ups").get(0).asText()).isEqualTo("Any parts replaced?");
        assertThat(metadata.path("evidence").get(0).asText()).isEqualTo("note_1");
    }

    @Test
    void appendsToExistingConversationAndLimitsHistory() {
        String jobId = "job-" + UUID.randomUUID();
        String conversationId = conversationStore.recordExchange(exchange(null, jobId, "first", "one"));
        String second = conversationStore.recordExchange(exchange(conversationId, jobId, "second", "two"));

        assertThat(second).isEqualTo(conversationId);
        assertThat(conversationStore.turns(conversationId)).extracting(StoredTurn::content)
                .containsExactly("first", "one", "second", "two");
        assertThat(conversationStore.recentHistory(conversationId, 3))
                .containsExactly(ChatMessage.assistant("one"), ChatMessage.user("second"), ChatMessage.assistant("two"));
    }

    @Test
    void scopesConversationsToTenantAndJob() {
        String jobId = "job-" + UUID.randomUUID();
        String conversationId = conversationStore.recordExchange(exchange(null, jobId, "hi", "hello"));

        assertThat(conversationStore.findConversation("tenant-1", jobId, conversationId)).contains(conversationId);
        assertThat(conversationStore.findConversation("tenant-1", "other-job", conversationId)).isEmpty();
        assertThat(conversationStore.findConversation("tenant-2", jobId, conversationId)).isEmpty();
        assertThat(conversationStore.findLatestConversation("tenant-1", jobId, "tech-1")).contains(conversationId);
        assertThat(conversationStore.findLatestConversation("tenant-1", jobId, "someone-else")).isEmpty();
    }

    private CompletedExchange exchange(String conversationId, String jobId, String question, String answer) {
        return new CompletedExchange(
                conversationId,
                "tenant-1",
                jobId,
                "tech-1",
                question,
                answer,
                List.of(new Citation("note_1", "2024-11-12", "note", "rattling", null, null)),
                List.of("Any parts replaced?"),
                List.of(new Evidence("note_1", "2024-11-12", "note", "rattling", null, null)),
                "gpt-4o",
                "copilot.v1"
        );
    }
}
