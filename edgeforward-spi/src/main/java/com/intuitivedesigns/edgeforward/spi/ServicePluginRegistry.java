/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */
package com.intuitivedesigns.edgeforward.spi;

import java.util.*;

/**
 * Registry for SPI discovery.
 *
 * <p>The ServiceLoader classpath scan runs <b>once</b> at construction and the
 * results are cached. Subsequent lookups are O(1).</p>
 *
 * @param <T> The SPI interface type (e.g., WriterFactory.class)
 */
public final class ServicePluginRegistry<T extends ServicePlugin> {
    private final Map<String, T> byId;

    public ServicePluginRegistry(Class<T> spiType) {
        this(spiType, Thread.currentThread().getContextClassLoader());
    }

    public ServicePluginRegistry(Class<T> spiType, ClassLoader cl) {
        this(spiType, ServiceLoader.load(spiType, cl));
    }

    private ServicePluginRegistry(Class<T> spiType, Iterable<T> plugins) {
        Map<String, T> tmp = new LinkedHashMap<>();
        for (T plugin : plugins) {
            String id = PluginIds.normalize(plugin.id());
            if (id.isEmpty()) {
                throw new IllegalStateException("Plugin id() must not be blank for " + plugin.getClass().getName());
            }
            if (tmp.containsKey(id)) {
                throw new IllegalStateException("Duplicate plugin ID '" + id + "' for SPI " + spiType.getSimpleName() + ". Conflict between: " + tmp.get(id).getClass().getName() + " and " + plugin.getClass().getName());
            }
            tmp.put(id, plugin);
        }
        this.byId = Collections.unmodifiableMap(tmp);
    }

    /**
     * Builds a registry from explicit instances instead of a classpath scan.
     */
    public static <T extends ServicePlugin> ServicePluginRegistry<T> of(Class<T> spiType, Collection<? extends T> plugins) {
        return new ServicePluginRegistry<>(spiType, new ArrayList<T>(plugins));
    }

    public T require(String id, String configKeyName) {
        String key = PluginIds.normalize(id);
        T plugin = byId.get(key);
        if (plugin == null) {
            throw new IllegalArgumentException("No plugin found for '" + configKeyName + "=" + id + "'. " + "Available options: " + byId.keySet());
        }
        return plugin;
    }

    public Set<String> availableIds() {
        return byId.keySet();
    }

    public Optional<T> get(String id) {
        return Optional.ofNullable(byId.get(PluginIds.normalize(id)));
    }
}
