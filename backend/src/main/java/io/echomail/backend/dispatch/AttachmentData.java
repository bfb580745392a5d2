package io.echomail.backend.dispatch;

import io.echomail.backend.provider.EmailAttachment;
import java.util.Base64;

/** Attachment as submitted by the client, with base64-encoded content. */
public record AttachmentData(String name, String contentType, String base64Data) {

  /**
   * Decodes the content into a provider attachment.
   *
   * @throws IllegalArgumentException if the name is missing or the data is not valid base64
   */
  public EmailAttachment toEmailAttachment() {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Attachment name is required");
    }
    byte[] content = Base64.getMimeDecoder().decode(base64Data == null ? "" : base64Data);
    return new EmailAttachment(name, contentType, content);
  }
}
