package com.mainframe.contract.layout;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

import com.mainframe.contract.layout.model.DeclarationNode;

import lombok.Value;

/**
 * Locates the groups referenced by {@code LIKE} and memoizes their relative layouts.
 * <p>
 * A reference is either {@code STRUCT.GROUP[.SUB]} (qualified by a top-level structure) or a name
 * searched inside the structure currently being flattened. A reference that is still being resolved
 * when it is requested again is a cycle.
 */
public class TemplateRegistry {

    private final Map<String, DeclarationNode> structures = new LinkedHashMap<>();
    private final Map<String, GroupTemplate> templates = new HashMap<>();
    private final Set<String> resolving = new LinkedHashSet<>();

    public TemplateRegistry(List<DeclarationNode> roots) {
        for (DeclarationNode root : roots) {
            structures.putIfAbsent(root.getName(), root);
        }
    }

    public Optional<Target> locate(String reference, String currentStructure) {
        if (reference == null || reference.isBlank()) {
            return Optional.empty();
        }
        String[] parts = reference.trim().toUpperCase(Locale.ROOT).split("\\.");
        DeclarationNode qualifiedRoot = structures.get(parts[0]);
        if (qualifiedRoot != null) {
            return descend(qualifiedRoot, parts, 1).map(node -> new Target(String.join(".", parts), parts[0], node));
        }
        DeclarationNode current = structures.get(currentStructure);
        if (current == null) {
            return Optional.empty();
        }
        return descend(current, parts, 0)
                .map(node -> new Target(currentStructure + "." + String.join(".", parts), currentStructure, node));
    }

    /**
     * Returns the memoized template for the target, building it on first use.
     *
     * @throws DeclarationException when the target is already being built (reference cycle)
     */
    public GroupTemplate resolve(Target target, Function<Target, GroupTemplate> builder) {
        GroupTemplate cached = templates.get(target.getKey());
        if (cached != null) {
            return cached;
        }
        if (!resolving.add(target.getKey())) {
            throw new DeclarationException("Template reference cycle: "
                    + String.join(" -> ", resolving) + " -> " + target.getKey());
        }
        try {
            GroupTemplate template = builder.apply(target);
            templates.put(target.getKey(), template);
            return template;
        } finally {
            resolving.remove(target.getKey());
        }
    }

    public int size() {
        return templates.size();
    }

    private static Optional<DeclarationNode> descend(DeclarationNode from, String[] path, int offset) {
        DeclarationNode node = from;
        for (int i = offset; i < path.length; i++) {
            node = node.findDescendant(path[i]);
            if (node == null) {
                return Optional.empty();
            }
        }
        return Optional.of(node);
    }

    @Value
    public static class Target {
        String key;
        String structureName;
        DeclarationNode node;
    }
}
