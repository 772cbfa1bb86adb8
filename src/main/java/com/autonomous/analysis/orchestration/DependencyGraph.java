package com.autonomous.analysis.orchestration;

import com.autonomous.analysis.exception.ConfigurationException;
import com.autonomous.analysis.model.RoleDefinition;
import com.autonomous.analysis.model.TaskState;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Static, validated declaration of which roles must finish before another role may start.
 *
 * <p>Roles keep their declaration order; every ordered view (ready set, closure, sub graph)
 * follows it so that scheduling and aggregation stay deterministic.</p>
 */
public final class DependencyGraph {

    private final List<String> roles;
    private final Map<String, Integer> declarationIndex;
    private final Map<String, List<Prerequisite>> prerequisites;
    private final Map<String, List<String>> dependents;

    private DependencyGraph(Map<String, List<Prerequisite>> declaration) {
        this.roles = List.copyOf(declaration.keySet());
        this.declarationIndex = new HashMap<>();
        for (int i = 0; i < roles.size(); i++) {
            declarationIndex.put(roles.get(i), i);
        }

        Map<String, List<Prerequisite>> prereqs = new LinkedHashMap<>();
        Map<String, List<String>> deps = new LinkedHashMap<>();
        roles.forEach(role -> deps.put(role, new ArrayList<>()));

        for (Map.Entry<String, List<Prerequisite>> entry : declaration.entrySet()) {
            String role = entry.getKey();
            List<Prerequisite> declared = entry.getValue() == null ? List.of() : entry.getValue();
            Set<String> seen = new HashSet<>();
            for (Prerequisite prerequisite : declared) {
                if (prerequisite.role().equals(role)) {
                    throw new ConfigurationException("Role '" + role + "' cannot depend on itself");
                }
                if (!declarationIndex.containsKey(prerequisite.role())) {
                    throw new ConfigurationException(
                        "Role '" + role + "' references unknown prerequisite '" + prerequisite.role() + "'");
                }
                if (!seen.add(prerequisite.role())) {
                    throw new ConfigurationException(
                        "Role '" + role + "' declares prerequisite '" + prerequisite.role() + "' more than once");
                }
                deps.get(prerequisite.role()).add(role);
            }
            prereqs.put(role, List.copyOf(declared));
        }

        this.prerequisites = Collections.unmodifiableMap(prereqs);
        Map<String, List<String>> frozen = new LinkedHashMap<>();
        deps.forEach((role, list) -> frozen.put(role, List.copyOf(list)));
        this.dependents = Collections.unmodifiableMap(frozen);

        rejectCycles();
    }

    public static DependencyGraph of(Map<String, List<Prerequisite>> declaration) {
        if (declaration == null || declaration.isEmpty()) {
            throw new ConfigurationException("Dependency graph declares no roles");
        }
        return new DependencyGraph(new LinkedHashMap<>(declaration));
    }

    public static DependencyGraph fromDefinitions(List<RoleDefinition> definitions) {
        Map<String, List<Prerequisite>> declaration = new LinkedHashMap<>();
        for (RoleDefinition definition : definitions) {
            String role = definition.getRole();
            if (role == null || role.isBlank()) {
                throw new ConfigurationException("Role definition without a role name");
            }
            if (declaration.containsKey(role)) {
                throw new ConfigurationException("Role '" + role + "' is declared more than once");
            }
            List<Prerequisite> edges = new ArrayList<>();
            definition.getPrerequisites().forEach(p -> edges.add(Prerequisite.mandatory(p)));
            for (String optional : definition.getOptionalPrerequisites()) {
                if (definition.getPrerequisites().contains(optional)) {
                    throw new ConfigurationException(
                        "Role '" + role + "' lists '" + optional + "' as both mandatory and optional");
                }
                edges.add(Prerequisite.optional(optional));
            }
            declaration.put(role, edges);
        }
        return of(declaration);
    }

    public List<String> roles() {
        return roles;
    }

    public int size() {
        return roles.size();
    }

    public boolean contains(String role) {
        return declarationIndex.containsKey(role);
    }

    public int indexOf(String role) {
        Integer index = declarationIndex.get(role);
        if (index == null) {
            throw new ConfigurationException("Unknown role '" + role + "'");
        }
        return index;
    }

    public List<Prerequisite> prerequisitesOf(String role) {
        indexOf(role);
        return prerequisites.get(role);
    }

    public List<String> dependentsOf(String role) {
        indexOf(role);
        return dependents.get(role);
    }

    /**
     * Roles that are still {@code WAITING} and whose prerequisites have all reached a terminal state.
     * Whether such a role runs or is skipped is the scheduler's decision.
     */
    public List<String> readySet(Map<String, TaskState> states) {
        List<String> ready = new ArrayList<>();
        for (String role : roles) {
            if (states.get(role) != TaskState.WAITING) {
                continue;
            }
            boolean prerequisitesDone = prerequisites.get(role).stream()
                .map(p -> states.get(p.role()))
                .allMatch(state -> state != null && state.isTerminal());
            if (prerequisitesDone) {
                ready.add(role);
            }
        }
        return ready;
    }

    /**
     * The selected roles plus every transitive prerequisite, in declaration order.
     * An empty selection means every declared role.
     */
    public List<String> closure(Collection<String> selected) {
        if (selected == null || selected.isEmpty()) {
            return roles;
        }
        List<String> unknown = selected.stream()
            .filter(role -> !declarationIndex.containsKey(role))
            .sorted()
            .collect(Collectors.toList());
        if (!unknown.isEmpty()) {
            throw new ConfigurationException("Unknown analysis role(s): " + String.join(", ", unknown));
        }

        Set<String> included = new HashSet<>();
        Deque<String> pending = new ArrayDeque<>(selected);
        while (!pending.isEmpty()) {
            String role = pending.pop();
            if (included.add(role)) {
                prerequisites.get(role).forEach(p -> pending.push(p.role()));
            }
        }
        return roles.stream().filter(included::contains).collect(Collectors.toList());
    }

    public DependencyGraph subgraph(Collection<String> selected) {
        List<String> kept = closure(selected);
        Map<String, List<Prerequisite>> declaration = new LinkedHashMap<>();
        kept.forEach(role -> declaration.put(role, prerequisites.get(role)));
        return new DependencyGraph(declaration);
    }

    private void rejectCycles() {
        Map<String, Integer> marks = new HashMap<>();
        Deque<String> path = new ArrayDeque<>();
        for (String role : roles) {
            visit(role, marks, path);
        }
    }

    // 0 = unvisited, 1 = on the current path, 2 = done
    private void visit(String role, Map<String, Integer> marks, Deque<String> path) {
        int mark = marks.getOrDefault(role, 0);
        if (mark == 2) {
            return;
        }
        if (mark == 1) {
            List<String> cycle = new ArrayList<>();
            for (String step : path) {
                cycle.add(0, step);
                if (step.equals(role)) {
                    break;
                }
            }
            cycle.add(role);
            throw new ConfigurationException("Dependency cycle detected: " + String.join(" -> ", cycle));
        }
        marks.put(role, 1);
        path.push(role);
        for (Prerequisite prerequisite : prerequisites.get(role)) {
            visit(prerequisite.role(), marks, path);
        }
        path.pop();
        marks.put(role, 2);
    }

    @Override
    public String toString() {
        return prerequisites.entrySet().stream()
            .map(e -> e.getKey() + " <- " + e.getValue().stream()
                .map(p -> p.optional() ? p.role() + "?" : p.role())
                .collect(Collectors.toList()))
            .collect(Collectors.joining(", ", "DependencyGraph[", "]"));
    }
}
