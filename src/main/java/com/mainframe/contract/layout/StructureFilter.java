package com.mainframe.contract.layout;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

import lombok.Value;

/**
 * Selects top-level structures by exact name or by name prefix. An empty filter selects everything.
 */
@Value
public class StructureFilter {

    Set<String> names;
    List<String> prefixes;

    public static StructureFilter all() {
        return new StructureFilter(Collections.emptySet(), Collections.emptyList());
    }

    public static StructureFilter of(Collection<String> names, Collection<String> prefixes) {
        Set<String> cleanNames = names == null ? Collections.emptySet() : names.stream()
                .filter(n -> n != null && !n.isBlank())
                .map(n -> n.trim().toUpperCase(Locale.ROOT))
                .collect(Collectors.toCollection(LinkedHashSet::new));
        List<String> cleanPrefixes = prefixes == null ? Collections.emptyList() : prefixes.stream()
                .filter(p -> p != null && !p.isBlank())
                .map(p -> p.trim().toUpperCase(Locale.ROOT))
                .collect(Collectors.toList());
        return new StructureFilter(Collections.unmodifiableSet(cleanNames), Collections.unmodifiableList(cleanPrefixes));
    }

    /**
     * Same filter with every name and prefix passed through the dialect's identifier normalization.
     */
    public StructureFilter normalizedWith(UnaryOperator<String> normalizer) {
        Set<String> normalizedNames = names.stream().map(normalizer)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        List<String> normalizedPrefixes = new ArrayList<>();
        for (String prefix : prefixes) {
            normalizedPrefixes.add(normalizer.apply(prefix));
        }
        return new StructureFilter(normalizedNames, normalizedPrefixes);
    }

    public boolean isEmpty() {
        return names.isEmpty() && prefixes.isEmpty();
    }

    public boolean matches(String structureName) {
        return isEmpty() || match(structureName).isPresent();
    }

    /**
     * Explains how a structure name was selected: exact match or the first matching prefix.
     */
    public Optional<Match> match(String structureName) {
        if (names.contains(structureName)) {
            return Optional.of(new Match(structureName, null));
        }
        for (String prefix : prefixes) {
            if (structureName.startsWith(prefix)) {
                return Optional.of(new Match(structureName, prefix));
            }
        }
        return Optional.empty();
    }

    @Value
    public static class Match {
        String structureName;
        String prefix;

        public boolean isExact() {
            return prefix == null;
        }
    }
}
