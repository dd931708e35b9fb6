package it.aw.readingqueue.model;

public record ChunkVector(String itemId, int position, String text, float[] vector) {}
