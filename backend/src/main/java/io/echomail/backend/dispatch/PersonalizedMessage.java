package io.echomail.backend.dispatch;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One recipient's message. Subject and body may contain {@code {{field}}} placeholders that are
 * resolved against {@code templateFields} at send time.
 */
public record PersonalizedMessage(
    String recipientAddress,
    String subject,
    String bodyHtml,
    List<AttachmentData> attachments,
    Map<String, String> templateFields) {

  public PersonalizedMessage {
    attachments = attachments == null ? List.of() : List.copyOf(attachments);
    templateFields = templateFields == null ? Map.of() : withoutNullValues(templateFields);
  }

  public static PersonalizedMessage of(String recipientAddress, String subject, String bodyHtml) {
    return new PersonalizedMessage(recipientAddress, subject, bodyHtml, List.of(), Map.of());
  }

  // spreadsheet rows routinely carry empty cells as null
  private static Map<String, String> withoutNullValues(Map<String, String> fields) {
    Map<String, String> copy = new LinkedHashMap<>();
    fields.forEach(
        (key, value) -> {
          if (key != null && value != null) {
            copy.put(key, value);
          }
        });
    return Collections.unmodifiableMap(copy);
  }
}
