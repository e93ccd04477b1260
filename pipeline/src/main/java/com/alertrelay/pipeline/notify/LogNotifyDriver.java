package com.alertrelay.pipeline.notify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Writes notifications to the application log. Registered as
 * {@value #NAME}.
 *
 * <p>
 * Optional channel config key {@code level}: {@code info} (default) or
 * {@code warn}.
 * </p>
 *
 * @since 1.0.0
 */
public class LogNotifyDriver implements NotifyDriver {

    private static final Logger LOG = LoggerFactory.getLogger(LogNotifyDriver.class);

    public static final String NAME = "log";

    private final AtomicLong sequence = new AtomicLong();

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean validateConfig(Map<String, Object> config) {
        if (config == null) {
            return false;
        }
        Object level = config.get("level");
        return level == null || "info".equals(level) || "warn".equals(level);
    }

    @Override
    public SendResult send(NotificationMessage message, Map<String, Object> config) {
        String level = config != null && config.get("level") != null
                ? String.valueOf(config.get("level")).toLowerCase(Locale.ROOT)
                : "info";
        if ("warn".equals(level)) {
            LOG.warn("[{}] [{}] {}\n{}", message.getChannel(), message.getSeverity(),
                    message.getTitle(), message.getMessage());
        } else {
            LOG.info("[{}] [{}] {}\n{}", message.getChannel(), message.getSeverity(),
                    message.getTitle(), message.getMessage());
        }
        return SendResult.ok("log-" + sequence.incrementAndGet(), Map.of("channel", message.getChannel()));
    }
}
