package com.autonomous.analysis.orchestration;

import com.autonomous.analysis.exception.DuplicateWriteException;
import com.autonomous.analysis.exception.ResultNotFoundException;
import com.autonomous.analysis.model.AgentResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Append-only results of one run, keyed by role.
 *
 * <p>A role is written once. {@link #replace} is the explicit retry-replace path: the new result
 * becomes current and earlier versions stay readable through {@link #history}.</p>
 */
public class ResultStore {

    private final List<String> declaredOrder;
    private final Map<String, List<AgentResult>> versions = new ConcurrentHashMap<>();

    public ResultStore(List<String> declaredOrder) {
        this.declaredOrder = List.copyOf(declaredOrder);
    }

    public void put(String role, AgentResult result) {
        checkRole(role, result);
        List<AgentResult> previous = versions.putIfAbsent(role, List.of(result));
        if (previous != null) {
            throw new DuplicateWriteException(role);
        }
    }

    public void replace(String role, AgentResult result) {
        checkRole(role, result);
        versions.merge(role, List.of(result), (existing, added) -> {
            List<AgentResult> merged = new ArrayList<>(existing);
            merged.addAll(added);
            return List.copyOf(merged);
        });
    }

    public Optional<AgentResult> get(String role) {
        List<AgentResult> list = versions.get(role);
        return list == null ? Optional.empty() : Optional.of(list.get(list.size() - 1));
    }

    public AgentResult require(String role) {
        return get(role).orElseThrow(() -> new ResultNotFoundException(role));
    }

    public List<AgentResult> history(String role) {
        return versions.getOrDefault(role, List.of());
    }

    public boolean contains(String role) {
        return versions.containsKey(role);
    }

    public int size() {
        return versions.size();
    }

    /**
     * Current result per role in declared role order, independent of completion order.
     */
    public Map<String, AgentResult> snapshot() {
        Map<String, AgentResult> ordered = new LinkedHashMap<>();
        for (String role : declaredOrder) {
            get(role).ifPresent(result -> ordered.put(role, result));
        }
        return Collections.unmodifiableMap(ordered);
    }

    private void checkRole(String role, AgentResult result) {
        if (!declaredOrder.contains(role)) {
            throw new IllegalArgumentException("Role '" + role + "' is not part of this run");
        }
        if (result == null || !role.equals(result.getRole())) {
            throw new IllegalArgumentException("Result does not belong to role '" + role + "'");
        }
    }
}
