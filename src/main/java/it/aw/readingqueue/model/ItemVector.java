package it.aw.readingqueue.model;

public record ItemVector(String itemId, float[] vector) {}
