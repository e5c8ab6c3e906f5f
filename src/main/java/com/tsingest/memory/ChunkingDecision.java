package com.tsingest.memory;

/**
 * Whether a file of {@code fileSizeBytes} is streamed, and with how many rows per chunk.
 */
public record ChunkingDecision(long fileSizeBytes, boolean chunked, int chunkRowCount) {}
