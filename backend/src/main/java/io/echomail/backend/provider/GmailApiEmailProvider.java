package io.echomail.backend.provider;

import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.internet.MimeMessage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Base64;
import java.util.Map;
import java.util.Properties;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Gmail API provider. Builds the full MIME message locally and posts it base64url-encoded to the
 * {@code messages/send} endpoint with the user's OAuth bearer token. The token is obtained by the
 * sign-in layer and exposed through {@code echomail.providers.gmail.access-token}.
 */
@Component
public class GmailApiEmailProvider implements EmailProvider {

  private static final Logger log = LoggerFactory.getLogger(GmailApiEmailProvider.class);

  static final int PRIORITY = 1;
  static final String SEND_PATH = "/gmail/v1/users/me/messages/send";
  static final String PROFILE_PATH = "/gmail/v1/users/me/profile";

  private static final ParameterizedTypeReference<Map<String, Object>> JSON_OBJECT =
      new ParameterizedTypeReference<>() {};

  private final RestClient restClient;
  private final Supplier<String> accessToken;
  private final String senderAddress;

  @Autowired
  public GmailApiEmailProvider(
      @Value("${echomail.providers.gmail.base-url:https://gmail.googleapis.com}") String baseUrl,
      @Value("${echomail.providers.gmail.access-token:}") String accessToken,
      @Value("${echomail.email.sender-address}") String senderAddress) {
    this(RestClient.builder().baseUrl(baseUrl), () -> accessToken, senderAddress);
  }

  GmailApiEmailProvider(
      RestClient.Builder restClientBuilder, Supplier<String> accessToken, String senderAddress) {
    this.restClient = restClientBuilder.build();
    this.accessToken = accessToken;
    this.senderAddress = senderAddress;
  }

  @Override
  public String providerId() {
    return "gmail";
  }

  @Override
  public int priority() {
    return PRIORITY;
  }

  @Override
  public boolean isAvailable() {
    String token = accessToken.get();
    return token != null && !token.isBlank();
  }

  @Override
  public SendResult send(EmailMessage message) {
    String raw;
    try {
      raw = encodeRaw(message);
    } catch (MessagingException | IOException e) {
      log.error("Failed to build MIME message for {}: {}", message.to(), e.getMessage());
      return SendResult.failed(providerId(), null, "Invalid message: " + e.getMessage());
    }

    try {
      Map<String, Object> body =
          restClient
              .post()
              .uri(SEND_PATH)
              .header(HttpHeaders.AUTHORIZATION, "Bearer " + accessToken.get())
              .contentType(MediaType.APPLICATION_JSON)
              .body(Map.of("raw", raw))
              .retrieve()
              .body(JSON_OBJECT);
      String messageId = body != null ? (String) body.get("id") : null;
      log.debug("Gmail email sent to {}, message id: {}", message.to(), messageId);
      return SendResult.accepted(providerId(), messageId);
    } catch (RestClientResponseException e) {
      int status = e.getStatusCode().value();
      log.error(
          "Gmail API error for {} ({}): {}", message.to(), status, e.getResponseBodyAsString());
      return SendResult.failed(
          providerId(),
          status,
          "Gmail API error (" + status + "): " + e.getResponseBodyAsString());
    } catch (RestClientException e) {
      log.error("Gmail API call failed for {}: {}", message.to(), e.getMessage());
      return SendResult.failed(providerId(), null, e.getMessage());
    }
  }

  @Override
  public ConnectionTestResult testConnection() {
    try {
      restClient
          .get()
          .uri(PROFILE_PATH)
          .header(HttpHeaders.AUTHORIZATION, "Bearer " + accessToken.get())
          .retrieve()
          .toBodilessEntity();
      return new ConnectionTestResult(true, providerId(), null);
    } catch (RestClientResponseException e) {
      return new ConnectionTestResult(
          false, providerId(), "Profile lookup failed: HTTP " + e.getStatusCode().value());
    } catch (RestClientException e) {
      log.error("Gmail connection test failed: {}", e.getMessage());
      return new ConnectionTestResult(false, providerId(), e.getMessage());
    }
  }

  String encodeRaw(EmailMessage message) throws MessagingException, IOException {
    MimeMessage mimeMessage = new MimeMessage(Session.getInstance(new Properties()));
    MimeMessageHelper helper =
        new MimeMessageHelper(mimeMessage, message.hasAttachments(), "UTF-8");
    helper.setFrom(senderAddress);
    helper.setTo(message.to());
    helper.setSubject(message.subject());
    if (message.htmlBody() != null && message.plainTextBody() != null) {
      helper.setText(message.plainTextBody(), message.htmlBody());
    } else if (message.htmlBody() != null) {
      helper.setText(message.htmlBody(), true);
    } else {
      helper.setText(message.plainTextBody() != null ? message.plainTextBody() : "", false);
    }
    if (message.replyTo() != null) {
      helper.setReplyTo(message.replyTo());
    }
    for (EmailAttachment attachment : message.attachments()) {
      helper.addAttachment(
          attachment.filename(),
          new ByteArrayResource(attachment.content()),
          attachment.contentType());
    }

    var out = new ByteArrayOutputStream();
    mimeMessage.writeTo(out);
    return Base64.getUrlEncoder().withoutPadding().encodeToString(out.toByteArray());
  }
}
