package it.aw.readingqueue.model;

public enum ClusteringMethod { KMEANS, HIERARCHICAL, DBSCAN }
