package com.supportdesk.assistant.service.platform;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class SlackPlatformClientTest {

    private final List<ClientRequest> requests = new ArrayList<>();

    @Test
    void postMessageCallsTheWebApiMethod() {
        SlackPlatformClient client = client(HttpStatus.OK, "{\"ok\":true,\"ts\":\"1.2\"}");

        client.postMessage("C1", "hello", "1.1");

        assertThat(requests).singleElement()
                .satisfies(request -> assertThat(request.url().getPath()).isEqualTo("/api/chat.postMessage"));
    }

    @Test
    void okFalseIsAnError() {
        SlackPlatformClient client = client(HttpStatus.OK, "{\"ok\":false,\"error\":\"channel_not_found\"}");

        assertThatThrownBy(() -> client.addReaction("C1", "1.1", "eyes"))
                .isInstanceOf(ChatPlatformException.class)
                .hasMessageContaining("channel_not_found");
    }

    @Test
    void httpErrorIsAnError() {
        SlackPlatformClient client = client(HttpStatus.TOO_MANY_REQUESTS, "{}");

        assertThatThrownBy(() -> client.removeReaction("C1", "1.1", "eyes"))
                .isInstanceOf(ChatPlatformException.class)
                .hasMessage("Slack reactions.remove returned 429");
    }

    @Test
    void processingReactionIsRemovedOnClose() {
        ChatPlatformClient platform = mock(ChatPlatformClient.class);

        try (ProcessingReaction reaction = ProcessingReaction.open(platform, "C1", "1.1", "eyes")) {
            assertThat(reaction.added()).isTrue();
        }

        verify(platform).addReaction("C1", "1.1", "eyes");
        verify(platform).removeReaction("C1", "1.1", "eyes");
    }

    @Test
    void processingReactionSwallowsRemovalFailure() {
        ChatPlatformClient platform = mock(ChatPlatformClient.class);
        doThrow(new ChatPlatformException("no_reaction")).when(platform).removeReaction("C1", "1.1", "eyes");

        ProcessingReaction reaction = ProcessingReaction.open(platform, "C1", "1.1", "eyes");
        reaction.close();

        verify(platform).removeReaction("C1", "1.1", "eyes");
    }

    private SlackPlatformClient client(HttpStatus status, String body) {
        WebClient webClient = WebClient.builder()
                .baseUrl("http://slack.test/api")
                .exchangeFunction(request -> {
                    requests.add(request);
                    return Mono.just(ClientResponse.create(status)
                            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                            .body(body)
                            .build());
                })
                .build();
        return new SlackPlatformClient(webClient, 5);
    }
}
