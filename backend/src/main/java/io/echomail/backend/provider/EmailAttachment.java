package io.echomail.backend.provider;

import java.util.Objects;

/** Binary attachment handed to a provider. */
public record EmailAttachment(String filename, String contentType, byte[] content) {

  public EmailAttachment {
    Objects.requireNonNull(filename, "filename");
    Objects.requireNonNull(content, "content");
    if (contentType == null || contentType.isBlank()) {
      contentType = "application/octet-stream";
    }
  }
}
