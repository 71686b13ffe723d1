package com.platform.gitops.model;

import java.util.Objects;

/**
 * Namespaced identity of a Kustomization unit.
 */
public record UnitKey(String namespace, String name) implements Comparable<UnitKey> {

    public UnitKey {
        Objects.requireNonNull(namespace, "namespace");
        Objects.requireNonNull(name, "name");
    }

    public static UnitKey of(String namespace, String name) {
        return new UnitKey(namespace, name);
    }

    /**
     * Parses the {@code namespace/name} form.
     */
    public static UnitKey parse(String value) {
        int slash = value.indexOf('/');
        if (slash <= 0 || slash == value.length() - 1) {
            throw new IllegalArgumentException("Expected namespace/name but got: " + value);
        }
        return new UnitKey(value.substring(0, slash), value.substring(slash + 1));
    }

    @Override
    public int compareTo(UnitKey other) {
        int byNamespace = namespace.compareTo(other.namespace);
        return byNamespace != 0 ? byNamespace : name.compareTo(other.name);
    }

    @Override
    public String toString() {
        return namespace + "/" + name;
    }
}
