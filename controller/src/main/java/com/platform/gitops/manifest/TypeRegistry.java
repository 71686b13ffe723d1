package com.platform.gitops.manifest;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of object kinds known to the controller, built once at startup and injected where
 * objects need to be classified or decoded. Unregistered kinds are treated as namespaced.
 */
public class TypeRegistry {

    /**
     * Whether objects of a kind live in a namespace.
     */
    public enum Scope {
        NAMESPACED,
        CLUSTER
    }

    private record Registration(Scope scope, Class<?> javaType) {
    }

    private final Map<String, Registration> registrations = new ConcurrentHashMap<>();
    private final ObjectMapper objectMapper;

    public TypeRegistry(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public TypeRegistry register(String group, String kind, Scope scope) {
        return register(group, kind, scope, null);
    }

    public TypeRegistry register(String group, String kind, Scope scope, Class<?> javaType) {
        registrations.put(key(group, kind), new Registration(scope, javaType));
        return this;
    }

    public boolean isNamespaced(String group, String kind) {
        Registration registration = registrations.get(key(group, kind));
        return registration == null || registration.scope() == Scope.NAMESPACED;
    }

    public Optional<Class<?>> javaType(String group, String kind) {
        return Optional.ofNullable(registrations.get(key(group, kind))).map(Registration::javaType);
    }

    /**
     * Decodes an unstructured object into the Java type registered for its kind.
     *
     * @throws IllegalArgumentException when the kind has no registered type or does not match
     */
    public <T> T decode(ManifestObject object, Class<T> type) {
        String group = object.identifier().group();
        Class<?> registered = javaType(group, object.kind())
            .orElseThrow(() -> new IllegalArgumentException(
                "no type registered for " + object.apiVersion() + ", Kind=" + object.kind()));
        if (!type.isAssignableFrom(registered)) {
            throw new IllegalArgumentException(
                "kind " + object.kind() + " decodes to " + registered.getSimpleName() + ", not " + type.getSimpleName());
        }
        return objectMapper.convertValue(object.content(), type);
    }

    public int size() {
        return registrations.size();
    }

    private static String key(String group, String kind) {
        return (group == null ? "" : group) + "/" + kind;
    }
}
