package com.alertrelay.core.driver;

import com.alertrelay.core.model.NormalizedPayload;

import java.util.Map;

/**
 * Adapter that recognizes and parses one monitoring source's webhook shape.
 *
 * <h3>Contract</h3>
 * <ul>
 * <li>{@link #validate(Map)} is a pure predicate over the payload shape and
 * never throws, whatever the input.</li>
 * <li>{@link #parse(Map)} throws {@link InvalidPayloadException} if and only
 * if {@code validate} returns {@code false} for the same payload.</li>
 * <li>{@link #generateFingerprint(Map, String)} is deterministic and
 * independent of label iteration order.</li>
 * </ul>
 *
 * @since 1.0.0
 */
public interface SourceDriver {

    /**
     * @return registry name, also used as the persisted alert {@code source}
     */
    String name();

    boolean validate(Map<String, Object> payload);

    /**
     * @throws InvalidPayloadException if the payload is not of this driver's shape
     */
    NormalizedPayload parse(Map<String, Object> payload);

    default String generateFingerprint(Map<String, String> labels, String name) {
        return Fingerprints.generate(labels, name);
    }
}
