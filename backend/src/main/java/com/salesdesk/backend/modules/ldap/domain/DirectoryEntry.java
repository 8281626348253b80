package com.salesdesk.backend.modules.ldap.domain;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * A directory entry: its distinguished name and string attribute values keyed case-insensitively.
 */
public record DirectoryEntry(String dn, Map<String, List<String>> attributes) {

    public DirectoryEntry {
        Objects.requireNonNull(dn, "dn is required");
        Map<String, List<String>> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (attributes != null) {
            attributes.forEach((name, values) -> {
                if (values != null && !values.isEmpty()) {
                    copy.put(name, List.copyOf(values));
                }
            });
        }
        attributes = Collections.unmodifiableMap(copy);
    }

    public List<String> values(String attributeName) {
        if (attributeName == null) {
            return List.of();
        }
        return attributes.getOrDefault(attributeName, List.of());
    }

    public Optional<String> firstValue(String attributeName) {
        List<String> values = values(attributeName);
        return values.isEmpty() ? Optional.empty() : Optional.of(values.get(0));
    }
}
