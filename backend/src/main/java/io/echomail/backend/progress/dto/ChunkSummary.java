package io.echomail.backend.progress.dto;

public record ChunkSummary(int sent, int failed, int skipped, int total, String message) {}
