package com.booking.sync.commons.util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Ordered lookup of named components where names are compared case-insensitively.
 * Registering a name twice keeps the last component.
 */
public class NamedRegistry<V> {

    private final Function<V, String> nameFunction;
    private final Map<String, V> components;

    public NamedRegistry(Function<V, String> nameFunction) {
        this.nameFunction = Objects.requireNonNull(nameFunction);
        this.components = Collections.synchronizedMap(new LinkedHashMap<>());
    }

    public NamedRegistry<V> register(V component) {
        Objects.requireNonNull(component);
        this.components.put(NamedRegistry.normalize(this.nameFunction.apply(component)), component);
        return this;
    }

    public Optional<V> find(String name) {
        if (name == null || name.trim().isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(this.components.get(NamedRegistry.normalize(name)));
    }

    public boolean isEmpty() {
        return this.components.isEmpty();
    }

    public int size() {
        return this.components.size();
    }

    public List<String> names() {
        synchronized (this.components) {
            return new ArrayList<>(this.components.keySet());
        }
    }

    public Collection<V> values() {
        synchronized (this.components) {
            return new ArrayList<>(this.components.values());
        }
    }

    public static String normalize(String name) {
        if (name == null) {
            throw new NullPointerException("Name can't be null");
        }
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
