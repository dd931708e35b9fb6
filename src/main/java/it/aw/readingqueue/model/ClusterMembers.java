package it.aw.readingqueue.model;

import java.util.List;

/** Input del labeler: le sintesi dei membri di un cluster, dalla più recente. */
public record ClusterMembers(int clusterId, List<String> memberSummaries) {}
