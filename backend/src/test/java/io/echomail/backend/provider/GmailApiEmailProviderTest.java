package io.echomail.backend.provider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

class GmailApiEmailProviderTest {

  private static final String BASE_URL = "https://gmail.test";

  private MockRestServiceServer server;
  private GmailApiEmailProvider provider;

  @BeforeEach
  void setUp() {
    RestClient.Builder builder = RestClient.builder().baseUrl(BASE_URL);
    server = MockRestServiceServer.bindTo(builder).build();
    provider = new GmailApiEmailProvider(builder, () -> "token-123", "sender@echomail.test");
  }

  @Test
  void posts_base64url_raw_message_with_bearer_token() {
    server
        .expect(requestTo(BASE_URL + GmailApiEmailProvider.SEND_PATH))
        .andExpect(method(HttpMethod.POST))
        .andExpect(header("Authorization", "Bearer token-123"))
        .andExpect(jsonPath("$.raw").isNotEmpty())
        .andRespond(withSuccess("{\"id\":\"gm-1\"}", MediaType.APPLICATION_JSON));

    var result =
        provider.send(
            EmailMessage.forCampaign("to@example.com", "Hi", "<p>Hello</p>", List.of(), "c-1"));

    server.verify();
    assertThat(result.success()).isTrue();
    assertThat(result.providerMessageId()).isEqualTo("gm-1");
    assertThat(result.provider()).isEqualTo("gmail");
  }

  @Test
  void raw_message_decodes_to_mime_with_headers_and_attachment() throws Exception {
    var attachment =
        new EmailAttachment("notes.txt", "text/plain", "abc".getBytes(StandardCharsets.UTF_8));
    var message =
        EmailMessage.forCampaign(
            "to@example.com", "Quarterly update", "<p>Body</p>", List.of(attachment), null);

    String raw = provider.encodeRaw(message);

    assertThat(raw).doesNotContain("=").doesNotContain("+").doesNotContain("/");
    String mime = new String(Base64.getUrlDecoder().decode(raw), StandardCharsets.UTF_8);
    assertThat(mime)
        .contains("To: to@example.com")
        .contains("From: sender@echomail.test")
        .contains("Subject: Quarterly update")
        .contains("notes.txt");
  }

  @Test
  void rate_limit_response_returns_status_429() {
    server
        .expect(requestTo(BASE_URL + GmailApiEmailProvider.SEND_PATH))
        .andRespond(
            withStatus(HttpStatus.TOO_MANY_REQUESTS)
                .contentType(MediaType.APPLICATION_JSON)
                .body("{\"error\":{\"message\":\"rateLimitExceeded\"}}"));

    var message = EmailMessage.forCampaign("to@example.com", "Hi", "<p>x</p>", List.of(), null);

    var result = provider.send(message);

    assertThat(result.success()).isFalse();
    assertThat(result.statusCode()).isEqualTo(429);
    assertThat(result.errorMessage()).contains("rateLimitExceeded");
  }

  @Test
  void network_failure_returns_failure_without_status() {
    server
        .expect(requestTo(BASE_URL + GmailApiEmailProvider.SEND_PATH))
        .andRespond(withException(new IOException("connection refused")));

    var message = EmailMessage.forCampaign("to@example.com", "Hi", "<p>x</p>", List.of(), null);

    var result = provider.send(message);

    assertThat(result.success()).isFalse();
    assertThat(result.statusCode()).isNull();
  }

  @Test
  void connection_test_reports_unauthorized_token() {
    server
        .expect(requestTo(BASE_URL + GmailApiEmailProvider.PROFILE_PATH))
        .andExpect(method(HttpMethod.GET))
        .andRespond(withStatus(HttpStatus.UNAUTHORIZED));

    var result = provider.testConnection();

    assertThat(result.success()).isFalse();
    assertThat(result.errorMessage()).contains("401");
  }

  @Test
  void unavailable_without_access_token() {
    var noToken =
        new GmailApiEmailProvider(RestClient.builder(), () -> "", "sender@echomail.test");

    assertThat(noToken.isAvailable()).isFalse();
    assertThat(provider.isAvailable()).isTrue();
  }
}
