package it.aw.readingqueue.model;

public enum ProjectionMethod { PCA, TSNE, UMAP }
