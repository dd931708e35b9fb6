package it.aw.readingqueue.model;

/**
 * Porzione contigua del testo di un item. {@code startOffset}/{@code endOffset}
 * sono offset di carattere nel testo completo (fine esclusa).
 */
public record TextChunk(int position, String text, int startOffset, int endOffset, int tokenCount) {}
