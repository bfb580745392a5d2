package io.echomail.backend.progress.dto;

/** Position of a chunk within the whole campaign. Indices are zero-based and inclusive. */
public record ChunkInfo(int totalEmails, int startIndex, int endIndex) {}
