package io.echomail.backend.progress.dto;

import io.echomail.backend.dispatch.AttachmentData;
import io.echomail.backend.dispatch.PersonalizedMessage;
import java.util.List;
import java.util.Map;

/** One email of a chunk, in the browser client's wire format. */
public record ChunkEmail(
    String to,
    String subject,
    String message,
    Map<String, String> originalRowData,
    List<AttachmentData> attachments) {

  public PersonalizedMessage toPersonalizedMessage() {
    return new PersonalizedMessage(to, subject, message, attachments, originalRowData);
  }
}
