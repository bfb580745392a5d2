package io.echomail.backend.bounce;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class BounceWebhookControllerTest {

  @Mock private BounceWebhookService webhookService;

  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    mockMvc = MockMvcBuilders.standaloneSetup(new BounceWebhookController(webhookService)).build();
  }

  @Test
  void processed_webhook_returns_result() throws Exception {
    when(webhookService.processWebhook(
            eq("sendgrid"), any(), eq("sig"), eq("1700000000"), isNull()))
        .thenReturn(
            new WebhookResult(
                "sendgrid", 1, List.of(EmailHealthStatus.clean("a@x.com"))));

    mockMvc
        .perform(
            post("/api/webhooks/bounces/sendgrid")
                .contentType(MediaType.APPLICATION_JSON)
                .header("X-Twilio-Email-Event-Webhook-Signature", "sig")
                .header("X-Twilio-Email-Event-Webhook-Timestamp", "1700000000")
                .content("[{\"email\":\"a@x.com\",\"event\":\"bounce\"}]"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.provider").value("sendgrid"))
        .andExpect(jsonPath("$.processed").value(1))
        .andExpect(jsonPath("$.addresses[0].address").value("a@x.com"));
  }

  @Test
  void authentication_failure_returns_401_without_body() throws Exception {
    when(webhookService.processWebhook(eq("sendgrid"), any(), any(), any(), any()))
        .thenThrow(new WebhookAuthenticationException("Invalid webhook signature"));

    mockMvc
        .perform(
            post("/api/webhooks/bounces/sendgrid")
                .contentType(MediaType.APPLICATION_JSON)
                .content("[]"))
        .andExpect(status().isUnauthorized())
        .andExpect(content().string(""));
  }

  @Test
  void payload_failure_returns_400() throws Exception {
    when(webhookService.processWebhook(eq("gmail"), any(), any(), any(), eq("tok")))
        .thenThrow(new WebhookPayloadException("Bounce payload has no email"));

    mockMvc
        .perform(
            post("/api/webhooks/bounces/gmail")
                .contentType(MediaType.APPLICATION_JSON)
                .header("X-Webhook-Token", "tok")
                .content("{}"))
        .andExpect(status().isBadRequest());
  }
}
