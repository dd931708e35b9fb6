package it.aw.readingqueue.model;

public record ChunkEmbedding(TextChunk chunk, float[] embedding) {}
