package it.aw.readingqueue.model;

public enum SearchMode { LEXICAL, SEMANTIC }
