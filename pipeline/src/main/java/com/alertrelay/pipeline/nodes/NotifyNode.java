package com.alertrelay.pipeline.nodes;

import com.alertrelay.core.check.CheckStatus;
import com.alertrelay.core.registry.UnknownEntryException;
import com.alertrelay.pipeline.node.AbstractPipelineNode;
import com.alertrelay.pipeline.node.NodeContext;
import com.alertrelay.pipeline.node.NodeResult;
import com.alertrelay.pipeline.node.NodeType;
import com.alertrelay.pipeline.notify.ChannelStore;
import com.alertrelay.pipeline.notify.NotificationChannel;
import com.alertrelay.pipeline.notify.NotificationMessage;
import com.alertrelay.pipeline.notify.NotificationSeverity;
import com.alertrelay.pipeline.notify.NotifyDriver;
import com.alertrelay.pipeline.notify.NotifyDriverRegistry;
import com.alertrelay.pipeline.notify.SendResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Sends one message summarizing the run to the configured channels.
 *
 * <h3>Channel selection</h3>
 * <p>
 * Config {@code drivers} (list) or {@code driver} (string) picks the active
 * channels served by those drivers, ordered by channel name. When nothing
 * matches, or no driver is configured, the first active channel is used.
 * </p>
 *
 * <h3>Message</h3>
 * <p>
 * Severity is the worse of the worst check status and the ingested alert
 * severity found in earlier outputs. The title is the intelligence summary
 * when one exists, otherwise it describes the check outcome or the incident.
 * The body has one line per earlier node.
 * </p>
 *
 * <h3>Failures</h3>
 * <p>
 * Each channel is attempted independently and gets a delivery record. The
 * node reports an error only when every attempted channel failed.
 * </p>
 *
 * @since 1.0.0
 */
public class NotifyNode extends AbstractPipelineNode {

    private static final Logger LOG = LoggerFactory.getLogger(NotifyNode.class);

    private final ChannelStore channels;
    private final NotifyDriverRegistry drivers;

    public NotifyNode(ChannelStore channels, NotifyDriverRegistry drivers) {
        this.channels = Objects.requireNonNull(channels, "channels must not be null");
        this.drivers = Objects.requireNonNull(drivers, "drivers must not be null");
    }

    @Override
    public NodeType type() {
        return NodeType.NOTIFY;
    }

    @Override
    protected void run(NodeContext context, Map<String, Object> config, NodeResult result) {
        List<NotificationChannel> targets = selectChannels(config);
        if (targets.isEmpty()) {
            result.addError("No active notification channels configured");
            return;
        }

        NotificationMessage message = buildMessage(context);
        List<Map<String, Object>> deliveries = new ArrayList<>();
        int succeeded = 0;
        for (NotificationChannel channel : targets) {
            Map<String, Object> delivery = deliver(channel, message.forChannel(channel.getName()));
            deliveries.add(delivery);
            if (Boolean.TRUE.equals(delivery.get("success"))) {
                succeeded++;
            }
        }

        result.put("deliveries", deliveries)
                .put("channels_attempted", targets.size())
                .put("channels_succeeded", succeeded)
                .put("channels_failed", targets.size() - succeeded)
                .put("title", message.getTitle())
                .put("severity", message.getSeverity().value());
        if (succeeded == 0) {
            result.addError("All " + targets.size() + " notification channel(s) failed");
        }
    }

    @Override
    public List<String> validateConfig(Map<String, Object> config) {
        List<String> errors = new ArrayList<>();
        if (config == null) {
            return errors;
        }
        Object driverList = config.get("drivers");
        if (driverList != null && !(driverList instanceof List<?> list
                && list.stream().allMatch(String.class::isInstance))) {
            errors.add("'drivers' must be a list of strings");
        }
        Object driver = config.get("driver");
        if (driver != null && !(driver instanceof String)) {
            errors.add("'driver' must be a string");
        }
        return errors;
    }

    // ---------------------------------------------------------------
    // Channel selection and delivery
    // ---------------------------------------------------------------

    private List<NotificationChannel> selectChannels(Map<String, Object> config) {
        List<NotificationChannel> active = channels.findActive();
        if (active.isEmpty()) {
            return List.of();
        }
        List<String> requested = configStringList(config, "drivers");
        if (requested == null) {
            requested = configStringList(config, "driver");
        }
        if (requested != null && !requested.isEmpty()) {
            List<String> wanted = requested;
            List<NotificationChannel> matching = active.stream()
                    .filter(channel -> wanted.contains(channel.getDriver()))
                    .toList();
            if (!matching.isEmpty()) {
                return matching;
            }
            LOG.warn("No active channel uses driver(s) {}; falling back to '{}'",
                    requested, active.get(0).getName());
        }
        return List.of(active.get(0));
    }

    private Map<String, Object> deliver(NotificationChannel channel, NotificationMessage message) {
        SendResult sent;
        try {
            NotifyDriver driver = drivers.create(channel.getDriver());
            if (!driver.validateConfig(channel.getConfig())) {
                sent = SendResult.failed("Invalid configuration for channel: " + channel.getName());
            } else {
                sent = driver.send(message, channel.getConfig());
            }
        } catch (UnknownEntryException e) {
            sent = SendResult.failed(e.getMessage());
        } catch (RuntimeException e) {
            LOG.warn("Delivery to channel '{}' threw", channel.getName(), e);
            sent = SendResult.failed(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
        if (sent == null) {
            sent = SendResult.failed("Driver returned no result");
        }
        if (!sent.isSuccess()) {
            LOG.warn("Delivery to channel '{}' failed: {}", channel.getName(), sent.getError());
        }

        Map<String, Object> delivery = new LinkedHashMap<>();
        delivery.put("channel", channel.getName());
        delivery.put("driver", channel.getDriver());
        delivery.put("success", sent.isSuccess());
        delivery.put("message_id", sent.getMessageId());
        delivery.put("error", sent.getError());
        return delivery;
    }

    // ---------------------------------------------------------------
    // Message building
    // ---------------------------------------------------------------

    static NotificationMessage buildMessage(NodeContext context) {
        CheckStatus worstCheck = null;
        NotificationSeverity alertSeverity = null;
        String summary = null;
        Object incidentId = context.getIncidentId();

        StringJoiner body = new StringJoiner("\n");
        for (Map.Entry<String, Map<String, Object>> entry : context.previousOutputs().entrySet()) {
            Map<String, Object> output = entry.getValue();
            if (output.get("worst_status") instanceof String status) {
                worstCheck = CheckStatus.worse(worstCheck, CheckStatus.fromValue(status));
            }
            if (output.containsKey("alert_fingerprint") && output.get("severity") instanceof String severity) {
                alertSeverity = NotificationSeverity.worse(alertSeverity, NotificationSeverity.normalize(severity));
            }
            if (output.containsKey("recommendations") && output.get("summary") instanceof String s && !s.isBlank()) {
                summary = s;
            }
            body.add("- " + entry.getKey() + ": " + describe(output));
        }

        NotificationSeverity severity = NotificationSeverity.worse(severityOf(worstCheck), alertSeverity);
        if (severity == null) {
            severity = NotificationSeverity.INFO;
        }

        String title;
        if (summary != null) {
            title = summary;
        } else if (worstCheck == CheckStatus.OK) {
            title = "All health checks passed";
        } else if (worstCheck != null) {
            title = "Health checks report " + worstCheck.value();
        } else if (incidentId != null) {
            title = "Incident " + incidentId;
        } else {
            title = "Pipeline notification";
        }

        return NotificationMessage.builder()
                .title(title)
                .message(body.length() > 0 ? body.toString() : "No node output.")
                .severity(severity)
                .tag("trace_id", context.getTraceId())
                .tag("run_id", context.getRunId())
                .tag("source", context.getSource())
                .tag("environment", context.getEnvironment())
                .context("incident_id", incidentId)
                .context("nodes", new ArrayList<>(context.previousOutputs().keySet()))
                .build();
    }

    private static NotificationSeverity severityOf(CheckStatus status) {
        if (status == null) {
            return null;
        }
        return switch (status) {
            case OK -> NotificationSeverity.SUCCESS;
            case WARNING, UNKNOWN -> NotificationSeverity.WARNING;
            case CRITICAL -> NotificationSeverity.CRITICAL;
        };
    }

    private static String describe(Map<String, Object> output) {
        if (output.isEmpty()) {
            return "(no output)";
        }
        StringJoiner parts = new StringJoiner(", ");
        output.forEach((key, value) -> {
            if (value instanceof List<?> list) {
                parts.add(key + "=[" + list.size() + " item(s)]");
            } else if (value instanceof Map<?, ?> map) {
                parts.add(key + "={" + map.size() + " entr" + (map.size() == 1 ? "y" : "ies") + "}");
            } else {
                parts.add(key + "=" + value);
            }
        });
        return parts.toString();
    }
}
