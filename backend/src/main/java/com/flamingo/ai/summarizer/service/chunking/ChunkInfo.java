package com.flamingo.ai.summarizer.service.chunking;

/** Statistics describing how a text would be split. */
public record ChunkInfo(
    int totalLength, int chunkCount, int windowSize, int overlap, double averageChunkLength) {}
