package com.archivist.taxonomy.service;

import java.util.List;
import java.util.UUID;

public record ClusteringResult(List<Group> clusters, List<UUID> noise, double epsilon) {

    public record Group(List<Member> members) {

        public int size() {
            return members.size();
        }

        public List<UUID> memberIds() {
            return members.stream().map(Member::documentId).toList();
        }

        public List<UUID> nearest(int count) {
            return memberIds().subList(0, Math.min(count, members.size()));
        }
    }

    public record Member(UUID documentId, double confidence) {}

    public int clusteredCount() {
        return clusters.stream().mapToInt(Group::size).sum();
    }
}
