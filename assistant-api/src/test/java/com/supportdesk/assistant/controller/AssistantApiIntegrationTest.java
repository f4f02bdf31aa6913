package com.supportdesk.assistant.controller;

import com.supportdesk.assistant.service.crm.CrmClient;
import com.supportdesk.assistant.service.llm.LlmClient;
import com.supportdesk.assistant.service.llm.LlmResponse;
import com.supportdesk.assistant.service.platform.ChatPlatformClient;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.time.Duration;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@AutoConfigureWebTestClient
@ActiveProfiles("test")
class AssistantApiIntegrationTest {

    @Autowired
    private WebTestClient webTestClient;

    @MockBean
    private CrmClient crmClient;

    @MockBean
    private ChatPlatformClient platformClient;

    @MockBean
    private LlmClient llmClient;

    @Test
    void registeredDraftCanBeRefinedThroughChatEvents() {
        webTestClient.post().uri("/api/drafts")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of(
                        "threadId", "1714564800.000100",
                        "channelId", "C1",
                        "conversationId", "cnv_1",
                        "text", "Hi Jane, we have looked into your duplicate charge and refunded it.",
                        "recipientEmail", "jane@example.com"))
                .exchange()
                .expectStatus().isCreated()
                .expectBody()
                .jsonPath("$.status").isEqualTo("draft")
                .jsonPath("$.versions[0].id").isEqualTo("v0");

        when(llmClient.generate(any())).thenReturn(new LlmResponse("Hi Jane, we refunded the duplicate charge.", "test"));

        webTestClient.mutate().responseTimeout(Duration.ofSeconds(10)).build()
                .post().uri("/api/chat/events")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of(
                        "type", "message",
                        "user", "U1",
                        "channel", "C1",
                        "text", "shorten it",
                        "ts", "1714564900.000200",
                        "thread_ts", "1714564800.000100"))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.route").isEqualTo("DRAFT_REFINED")
                .jsonPath("$.threadId").isEqualTo("1714564800.000100");

        webTestClient.get().uri("/api/drafts/{threadId}", "1714564800.000100")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.versions.length()").isEqualTo(2)
                .jsonPath("$.versions[1].intent").isEqualTo("shorten");

        verify(platformClient).postMessage(any(), any(), any());
    }

    @Test
    void invalidEventIsRejected() {
        webTestClient.post().uri("/api/chat/events")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("text", "status"))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("Invalid request: channel, ts");
    }

    @Test
    void unknownDraftIsNotFound() {
        webTestClient.get().uri("/api/drafts/{threadId}", "nope")
                .exchange()
                .expectStatus().isNotFound();
    }
}
