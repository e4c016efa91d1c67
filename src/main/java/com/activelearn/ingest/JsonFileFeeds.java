package com.activelearn.ingest;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

public class JsonFileFeeds implements ApprovalFeed, FeedbackFeed, GoldSetFeed {
    private final Path approvalsPath;
    private final Path feedbackPath;
    private final Path goldPath;
    private final ObjectMapper mapper = JsonMapper.builder()
            .findAndAddModules()
            .build();

    public JsonFileFeeds(Path approvalsPath, Path feedbackPath, Path goldPath) {
        this.approvalsPath = approvalsPath;
        this.feedbackPath = feedbackPath;
        this.goldPath = goldPath;
    }

    @Override
    public List<ApprovalEvent> fetchApprovals(Instant since, int limit) throws UpstreamUnavailableException {
        List<ApprovalEvent> events = read("approvals", approvalsPath, new TypeReference<List<ApprovalEvent>>() {
        });
        return events.stream()
                .filter(ApprovalEvent::isResolved)
                .filter(event -> event.createdAt() != null && !event.createdAt().isBefore(since))
                .sorted(Comparator.comparing(ApprovalEvent::createdAt).reversed())
                .limit(limit)
                .toList();
    }

    @Override
    public List<FeedbackAggregate> fetchFeedback(LocalDate since, int limit) throws UpstreamUnavailableException {
        List<FeedbackAggregate> aggregates = read("feedback", feedbackPath, new TypeReference<List<FeedbackAggregate>>() {
        });
        return aggregates.stream()
                .filter(aggregate -> aggregate.date() != null && !aggregate.date().isBefore(since))
                .limit(limit)
                .toList();
    }

    @Override
    public List<GoldTask> fetchGoldTasks(String agent, int limit) throws UpstreamUnavailableException {
        List<GoldTask> tasks = read("gold", goldPath, new TypeReference<List<GoldTask>>() {
        });
        return tasks.stream()
                .filter(task -> agent == null || agent.equals(task.agent()))
                .limit(limit)
                .toList();
    }

    private <T> List<T> read(String source, Path path, TypeReference<List<T>> type) throws UpstreamUnavailableException {
        if (path == null || !Files.exists(path)) {
            throw new UpstreamUnavailableException(source, "Export not found: " + path);
        }
        try {
            if (Files.size(path) == 0L) {
                return List.of();
            }
            return mapper.readValue(path.toFile(), type);
        } catch (IOException e) {
            throw new UpstreamUnavailableException(source, "Unable to read export " + path, e);
        }
    }
}
