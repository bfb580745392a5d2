package io.echomail.backend.dispatch;

import io.echomail.backend.provider.EmailAttachment;
import io.echomail.backend.provider.EmailMessage;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Resolves {@code {{field}}} placeholders and turns a {@link PersonalizedMessage} into a
 * provider-ready {@link EmailMessage}. Unknown placeholders are left in place.
 */
@Component
public class PlaceholderRenderer {

  private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\s*([\\w.\\- ]+?)\\s*}}");

  public String render(String template, Map<String, String> fields) {
    if (template == null || template.isEmpty() || fields.isEmpty()) {
      return template == null ? "" : template;
    }
    Matcher matcher = PLACEHOLDER.matcher(template);
    StringBuilder out = new StringBuilder();
    while (matcher.find()) {
      String value = fields.get(matcher.group(1));
      String replacement = value != null ? value : matcher.group();
      matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
    }
    matcher.appendTail(out);
    return out.toString();
  }

  /**
   * @throws IllegalArgumentException if the recipient is blank or an attachment cannot be decoded
   */
  public EmailMessage toEmailMessage(PersonalizedMessage message, String campaignId) {
    if (message.recipientAddress() == null || message.recipientAddress().isBlank()) {
      throw new IllegalArgumentException("Invalid email: recipient address is blank");
    }
    Map<String, String> fields = message.templateFields();
    List<EmailAttachment> attachments =
        message.attachments().stream().map(AttachmentData::toEmailAttachment).toList();
    return EmailMessage.forCampaign(
        message.recipientAddress().trim(),
        render(message.subject(), fields),
        render(message.bodyHtml(), fields),
        attachments,
        campaignId);
  }
}
