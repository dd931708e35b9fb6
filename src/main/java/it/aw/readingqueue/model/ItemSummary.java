package it.aw.readingqueue.model;

import java.time.LocalDateTime;

public record ItemSummary(String itemId, String summary, LocalDateTime createdAt) {}
