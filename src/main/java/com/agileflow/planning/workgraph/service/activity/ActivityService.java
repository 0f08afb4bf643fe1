package com.agileflow.planning.workgraph.service.activity;

import com.agileflow.planning.workgraph.model.ActivityEvent;
import com.agileflow.planning.workgraph.repository.ActivityEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * Audit sink for dependency changes and rebalance moves.
 * <p>
 * Recording is fire-and-forget: it runs on the activity executor and a failing write is logged,
 * never propagated to the operation that emitted the event.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ActivityService {

    private final ActivityEventRepository activityEventRepository;

    @Async("activityExecutor")
    public void record(String action, String entityType, String entityId, String userId,
                       String description, Map<String, Object> metadata) {
        try {
            ActivityEvent event = ActivityEvent.builder()
                    .action(action)
                    .entityType(entityType)
                    .entityId(entityId)
                    .userId(userId)
                    .description(description)
                    .metadata(metadata)
                    .createdAt(LocalDateTime.now())
                    .build();
            activityEventRepository.save(event);
            log.debug("Recorded activity {} on {} {}", action, entityType, entityId);
        } catch (Exception e) {
            log.error("Failed to record activity {} on {} {}: {}", action, entityType, entityId, e.getMessage(), e);
        }
    }

    /**
     * Delete activity events created before {@code cutoff}.
     *
     * @return number of deleted events
     */
    public long purgeOlderThan(LocalDateTime cutoff) {
        long deleted = activityEventRepository.deleteByCreatedAtBefore(cutoff);
        log.info("Purged {} activity event(s) created before {}", deleted, cutoff);
        return deleted;
    }
}
