package com.bothsides.rostersync.controller;

import com.bothsides.rostersync.config.SecurityConfig;
import com.bothsides.rostersync.exception.InvalidWebhookEventException;
import com.bothsides.rostersync.model.WebhookAction;
import com.bothsides.rostersync.model.WebhookEvent;
import com.bothsides.rostersync.service.WebhookIntakeService;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.security.oauth2.jwt.ReactiveJwtDecoder;
import org.springframework.security.test.context.support.WithMockUser;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@WebFluxTest(WebhookController.class)
@Import(SecurityConfig.class)
class WebhookControllerTest {

    @Autowired
    private WebTestClient webTestClient;

    @MockBean
    private WebhookIntakeService intakeService;

    @MockBean
    private ReactiveJwtDecoder jwtDecoder;

    @Test
    @WithMockUser(roles = "INTEGRATION")
    void receiveWebhook_Accepted() {
        // Arrange
        when(intakeService.processWebhook(any())).thenReturn(Mono.just("sync_school-A_real_time_1"));

        // Act & Assert
        webTestClient.post()
                .uri("/api/webhooks/school-A")
                .contentType(MediaType.APPLICATION_JSON)
                .header("X-Webhook-Signature", "sha256=abc")
                .bodyValue(body("update"))
                .exchange()
                .expectStatus().isAccepted()
                .expectBody()
                .jsonPath("$.jobId").isEqualTo("sync_school-A_real_time_1");

        ArgumentCaptor<WebhookEvent> event = ArgumentCaptor.forClass(WebhookEvent.class);
        verify(intakeService).processWebhook(event.capture());
        assertThat(event.getValue().getIntegrationId()).isEqualTo("school-A");
        assertThat(event.getValue().getAction()).isEqualTo(WebhookAction.UPDATE);
        assertThat(event.getValue().getSignature()).isEqualTo("sha256=abc");
        assertThat(event.getValue().getHeaders()).containsEntry("x-webhook-signature", "sha256=abc");
        assertThat(event.getValue().getPayload()).containsEntry("firstName", "Ada");
    }

    @Test
    @WithMockUser(roles = "INTEGRATION")
    void receiveWebhook_InvalidAction() {
        when(intakeService.processWebhook(any()))
                .thenReturn(Mono.error(new InvalidWebhookEventException("Webhook event is missing a valid action")));

        webTestClient.post()
                .uri("/api/webhooks/school-A")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body("archive"))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("Invalid Webhook Event");
    }

    @Test
    @WithMockUser(roles = "USER")
    void receiveWebhook_ForbiddenForRegularUser() {
        webTestClient.post()
                .uri("/api/webhooks/school-A")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body("update"))
                .exchange()
                .expectStatus().isForbidden();

        verifyNoInteractions(intakeService);
    }

    private static Map<String, Object> body(String action) {
        return Map.of(
                "id", "evt-1",
                "eventType", "student.updated",
                "entityType", "student",
                "entityId", "s1",
                "action", action,
                "payload", Map.of("firstName", "Ada"));
    }
}
