package io.echomail.backend.provider;

import com.sendgrid.Method;
import com.sendgrid.Request;
import com.sendgrid.Response;
import com.sendgrid.SendGrid;
import com.sendgrid.helpers.mail.Mail;
import com.sendgrid.helpers.mail.objects.Attachments;
import com.sendgrid.helpers.mail.objects.Content;
import com.sendgrid.helpers.mail.objects.Email;
import com.sendgrid.helpers.mail.objects.Personalization;
import java.io.IOException;
import java.util.Base64;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * SendGrid REST provider authenticated with an API key. Campaign metadata is copied into SendGrid
 * custom args so the event webhook can attribute bounces to a campaign.
 */
@Component
public class SendGridEmailProvider implements EmailProvider {

  private static final Logger log = LoggerFactory.getLogger(SendGridEmailProvider.class);

  static final int PRIORITY = 2;

  private final String apiKey;
  private final String senderAddress;
  private final Function<String, SendGrid> sendGridFactory;

  @Autowired
  public SendGridEmailProvider(
      @Value("${echomail.providers.sendgrid.api-key:}") String apiKey,
      @Value("${echomail.email.sender-address}") String senderAddress) {
    this(apiKey, senderAddress, SendGrid::new);
  }

  SendGridEmailProvider(
      String apiKey, String senderAddress, Function<String, SendGrid> sendGridFactory) {
    this.apiKey = apiKey;
    this.senderAddress = senderAddress;
    this.sendGridFactory = sendGridFactory;
  }

  @Override
  public String providerId() {
    return "sendgrid";
  }

  @Override
  public int priority() {
    return PRIORITY;
  }

  @Override
  public boolean isAvailable() {
    return apiKey != null && !apiKey.isBlank();
  }

  @Override
  public SendResult send(EmailMessage message) {
    try {
      return send(buildMail(message));
    } catch (IOException e) {
      log.error("Failed to send SendGrid email to {}: {}", message.to(), e.getMessage());
      return SendResult.failed(providerId(), null, e.getMessage());
    }
  }

  @Override
  public ConnectionTestResult testConnection() {
    try {
      SendGrid sg = sendGridFactory.apply(apiKey);
      Request request = new Request();
      request.setMethod(Method.GET);
      request.setEndpoint("api_keys");
      Response response = sg.api(request);
      // 200 = full access, 403 = authenticated but restricted scope; both confirm a valid key
      if (response.getStatusCode() == 200 || response.getStatusCode() == 403) {
        return new ConnectionTestResult(true, providerId(), null);
      }
      return new ConnectionTestResult(
          false, providerId(), "API key validation failed: HTTP " + response.getStatusCode());
    } catch (IOException e) {
      log.error("SendGrid connection test failed: {}", e.getMessage());
      return new ConnectionTestResult(false, providerId(), e.getMessage());
    }
  }

  private Mail buildMail(EmailMessage message) {
    if (message.htmlBody() == null && message.plainTextBody() == null) {
      throw new IllegalArgumentException(
          "Email must have at least one of htmlBody or plainTextBody");
    }

    Personalization personalization = new Personalization();
    personalization.addTo(new Email(message.to()));
    message.metadata().forEach(personalization::addCustomArg);

    Mail mail = new Mail();
    mail.setFrom(new Email(senderAddress));
    mail.setSubject(message.subject());
    mail.addPersonalization(personalization);

    if (message.replyTo() != null) {
      mail.setReplyTo(new Email(message.replyTo()));
    }
    // SendGrid requires text/plain to precede text/html
    if (message.plainTextBody() != null) {
      mail.addContent(new Content("text/plain", message.plainTextBody()));
    }
    if (message.htmlBody() != null) {
      mail.addContent(new Content("text/html", message.htmlBody()));
    }

    for (EmailAttachment attachment : message.attachments()) {
      Attachments sgAttachment = new Attachments();
      sgAttachment.setContent(Base64.getEncoder().encodeToString(attachment.content()));
      sgAttachment.setType(attachment.contentType());
      sgAttachment.setFilename(attachment.filename());
      sgAttachment.setDisposition("attachment");
      mail.addAttachments(sgAttachment);
    }
    return mail;
  }

  private SendResult send(Mail mail) throws IOException {
    SendGrid sg = sendGridFactory.apply(apiKey);
    Request request = new Request();
    request.setMethod(Method.POST);
    request.setEndpoint("mail/send");
    request.setBody(mail.build());

    Response response = sg.api(request);
    int status = response.getStatusCode();

    if (status >= 200 && status < 300) {
      String sgMessageId = response.getHeaders().get("X-Message-Id");
      log.debug("SendGrid email sent, sg_message_id: {}", sgMessageId);
      return SendResult.accepted(providerId(), sgMessageId);
    }
    String errorBody = response.getBody();
    log.error("SendGrid API returned {}: {}", status, errorBody);
    return SendResult.failed(
        providerId(), status, "SendGrid API error " + status + ": " + errorBody);
  }
}
