package com.alertrelay.pipeline.intelligence;

import com.alertrelay.core.model.Alert;
import com.alertrelay.core.model.Incident;
import com.alertrelay.core.store.AlertQuery;
import com.alertrelay.core.store.AlertStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Offline provider registered as {@value #NAME}.
 *
 * <p>
 * Classifies an incident by keywords found in its title, its description and
 * the names and descriptions of its attached alerts, then returns a fixed
 * playbook for that class. Memory keywords win over disk, disk over CPU.
 * Anything unclassified, or a run without an incident, gets a single
 * general health-review recommendation.
 * </p>
 *
 * <p>
 * Priority follows the incident severity: critical incidents get
 * {@link RecommendationPriority#CRITICAL}, warnings
 * {@link RecommendationPriority#HIGH}, everything else
 * {@link RecommendationPriority#MEDIUM}.
 * </p>
 *
 * @since 1.0.0
 */
public class KeywordRecommendationProvider implements AnalysisProvider {

    private static final Logger LOG = LoggerFactory.getLogger(KeywordRecommendationProvider.class);

    public static final String NAME = "local";

    private static final List<String> MEMORY_KEYWORDS =
            List.of("memory", "ram", "oom", "out of memory", "mem", "swap");
    private static final List<String> DISK_KEYWORDS =
            List.of("disk", "storage", "space", "filesystem", "inode", "quota");
    private static final List<String> CPU_KEYWORDS =
            List.of("cpu", "load", "processor", "compute");

    private final AlertStore store;

    /**
     * @param store source of attached alerts; {@code null} classifies on the incident alone
     */
    public KeywordRecommendationProvider(AlertStore store) {
        this.store = store;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<Recommendation> run(Incident incident) {
        if (incident == null) {
            return List.of(general(null));
        }
        RecommendationType type = classify(incident);
        LOG.debug("Incident {} classified as {}", incident.getId(), type);
        return switch (type) {
            case MEMORY -> List.of(memory(incident));
            case DISK -> List.of(disk(incident));
            case CPU -> List.of(cpu(incident));
            default -> List.of(general(incident.getId()));
        };
    }

    RecommendationType classify(Incident incident) {
        StringBuilder text = new StringBuilder()
                .append(Objects.toString(incident.getTitle(), "")).append(' ')
                .append(Objects.toString(incident.getDescription(), ""));
        if (store != null && incident.getId() != null) {
            for (Alert alert : store.findAlerts(AlertQuery.attachedTo(incident.getId()))) {
                text.append(' ').append(Objects.toString(alert.getName(), ""))
                        .append(' ').append(Objects.toString(alert.getDescription(), ""));
            }
        }
        String haystack = text.toString().toLowerCase(Locale.ROOT);
        if (containsAny(haystack, MEMORY_KEYWORDS)) {
            return RecommendationType.MEMORY;
        }
        if (containsAny(haystack, DISK_KEYWORDS)) {
            return RecommendationType.DISK;
        }
        if (containsAny(haystack, CPU_KEYWORDS)) {
            return RecommendationType.CPU;
        }
        return RecommendationType.GENERAL;
    }

    // ---------------------------------------------------------------
    // Playbooks
    // ---------------------------------------------------------------

    private static Recommendation memory(Incident incident) {
        return Recommendation.builder()
                .type(RecommendationType.MEMORY)
                .priority(priorityOf(incident))
                .title("High Memory Usage Detected")
                .description("Incident '" + incident.getTitle() + "' points at memory pressure.")
                .action("Identify the top memory-consuming processes")
                .action("Consider restarting memory-heavy services during maintenance window")
                .action("Check for memory leaks in long-running processes")
                .action("Consider increasing system memory if this is recurring")
                .incidentId(incident.getId())
                .build();
    }

    private static Recommendation disk(Incident incident) {
        Map<String, Object> metadata = incident.getMetadata();
        Object path = metadata != null ? metadata.get("path") : null;
        String affectedPath = path != null ? String.valueOf(path) : "/";
        return Recommendation.builder()
                .type(RecommendationType.DISK)
                .priority(priorityOf(incident))
                .title("Large Files and Directories Found")
                .description("Incident '" + incident.getTitle() + "' points at disk pressure on "
                        + affectedPath + ".")
                .detail("path", affectedPath)
                .action("Review the largest files and directories under " + affectedPath)
                .action("Rotate or compress old logs")
                .action("Clean temporary and cache directories")
                .action("Consider expanding the volume if growth is expected")
                .incidentId(incident.getId())
                .build();
    }

    private static Recommendation cpu(Incident incident) {
        return Recommendation.builder()
                .type(RecommendationType.CPU)
                .priority(priorityOf(incident))
                .title("High CPU Usage Detected")
                .description("Incident '" + incident.getTitle() + "' points at CPU saturation.")
                .action("Identify the top CPU-consuming processes")
                .action("Check for runaway processes or infinite loops")
                .action("Consider process priority adjustments (nice/renice)")
                .action("Review cron jobs and scheduled tasks")
                .incidentId(incident.getId())
                .build();
    }

    private static Recommendation general(Long incidentId) {
        return Recommendation.builder()
                .type(RecommendationType.GENERAL)
                .priority(RecommendationPriority.LOW)
                .title("General Health Review")
                .description("No specific resource pattern recognized.")
                .action("Review recent deployments and configuration changes")
                .action("Check service logs around the incident start time")
                .incidentId(incidentId)
                .build();
    }

    private static RecommendationPriority priorityOf(Incident incident) {
        if (incident.getSeverity() == null) {
            return RecommendationPriority.MEDIUM;
        }
        return switch (incident.getSeverity()) {
            case CRITICAL -> RecommendationPriority.CRITICAL;
            case WARNING -> RecommendationPriority.HIGH;
            case INFO -> RecommendationPriority.MEDIUM;
        };
    }

    private static boolean containsAny(String haystack, List<String> keywords) {
        return keywords.stream().anyMatch(haystack::contains);
    }
}
