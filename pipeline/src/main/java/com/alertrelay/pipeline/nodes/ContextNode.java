package com.alertrelay.pipeline.nodes;

import com.alertrelay.core.check.CheckResult;
import com.alertrelay.core.check.CheckRun;
import com.alertrelay.core.check.CheckStatus;
import com.alertrelay.core.check.Checker;
import com.alertrelay.core.check.CheckerRegistry;
import com.alertrelay.core.lifecycle.CheckAlertBridge;
import com.alertrelay.core.lifecycle.ProcessingResult;
import com.alertrelay.core.registry.UnknownEntryException;
import com.alertrelay.core.store.CheckRunStore;
import com.alertrelay.pipeline.node.AbstractPipelineNode;
import com.alertrelay.pipeline.node.NodeContext;
import com.alertrelay.pipeline.node.NodeResult;
import com.alertrelay.pipeline.node.NodeType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runs health checkers and reports their results.
 *
 * <h3>Config</h3>
 * <ul>
 * <li>{@code checkers}: a name or a list of names; defaults to every enabled checker</li>
 * <li>{@code create_alerts}: when {@code true}, each result is also pushed
 * through the {@link CheckAlertBridge} so failing checks raise alerts</li>
 * </ul>
 *
 * <h3>Output</h3>
 * <p>
 * {@code checks} (name to result map), {@code checks_run},
 * {@code checks_passed}, {@code checks_failed}, {@code worst_status} and,
 * with {@code create_alerts}, the lifecycle counts under {@code alerts}.
 * A checker that throws is reported as an {@code unknown} result, not as a
 * node error; an unknown checker name is a node error.
 * </p>
 *
 * @since 1.0.0
 */
public class ContextNode extends AbstractPipelineNode {

    private static final Logger LOG = LoggerFactory.getLogger(ContextNode.class);

    private final CheckerRegistry checkers;
    private final CheckRunStore checkRuns;
    private final CheckAlertBridge bridge;

    /**
     * @param checkers  checker registry
     * @param checkRuns audit store; {@code null} disables recording
     * @param bridge    check-to-alert bridge; {@code null} disables {@code create_alerts}
     */
    public ContextNode(CheckerRegistry checkers, CheckRunStore checkRuns, CheckAlertBridge bridge) {
        this.checkers = Objects.requireNonNull(checkers, "checkers must not be null");
        this.checkRuns = checkRuns;
        this.bridge = bridge;
    }

    @Override
    public NodeType type() {
        return NodeType.CONTEXT;
    }

    @Override
    protected void run(NodeContext context, Map<String, Object> config, NodeResult result) {
        List<String> names = configStringList(config, "checkers");
        if (names == null) {
            names = checkers.enabledNames();
        }
        boolean createAlerts = configBoolean(config, "create_alerts", false);
        if (createAlerts && bridge == null) {
            result.addError("create_alerts requires a check-alert bridge");
            createAlerts = false;
        }

        Map<String, Object> checks = new LinkedHashMap<>();
        ProcessingResult alerts = new ProcessingResult();
        int passed = 0;
        int failed = 0;
        CheckStatus worst = null;

        for (String name : names) {
            Checker checker;
            try {
                checker = checkers.create(name);
            } catch (UnknownEntryException e) {
                result.addError(e.getMessage());
                continue;
            }

            CheckResult checkResult;
            long start = System.nanoTime();
            try {
                checkResult = checker.check();
            } catch (RuntimeException e) {
                LOG.warn("Checker '{}' failed", name, e);
                checkResult = CheckResult.failed(name, e);
            }
            long durationMs = (System.nanoTime() - start) / 1_000_000;

            if (checkRuns != null) {
                checkRuns.record(CheckRun.of(checkResult, durationMs, context.getTraceId()));
            }
            checks.put(name, checkResult.toMap());
            if (checkResult.isOk()) {
                passed++;
            } else {
                failed++;
            }
            worst = CheckStatus.worse(worst, checkResult.getStatus());

            if (createAlerts) {
                alerts.merge(bridge.processCheckResult(checkResult, null));
            }
        }

        result.put("checks", checks)
                .put("checks_run", checks.size())
                .put("checks_passed", passed)
                .put("checks_failed", failed)
                .put("worst_status", worst != null ? worst.value() : CheckStatus.OK.value());
        if (createAlerts) {
            result.put("alerts", alerts.toMap());
            alerts.getErrors().forEach(result::addError);
        }
    }

    @Override
    public List<String> validateConfig(Map<String, Object> config) {
        List<String> errors = new ArrayList<>();
        if (config == null) {
            return errors;
        }
        String checkersError = checkStringOrList(config, "checkers");
        if (checkersError != null) {
            errors.add(checkersError);
        }
        Object createAlerts = config.get("create_alerts");
        if (createAlerts != null && !(createAlerts instanceof Boolean)) {
            errors.add("'create_alerts' must be a boolean");
        }
        return errors;
    }
}
