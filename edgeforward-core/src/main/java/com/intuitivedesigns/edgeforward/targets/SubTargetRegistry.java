/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.edgeforward.targets;

import com.intuitivedesigns.edgeforward.config.ConfigurationException;
import com.intuitivedesigns.edgeforward.config.ForwarderConfig;
import com.intuitivedesigns.edgeforward.config.TargetConfiguration;
import com.intuitivedesigns.edgeforward.core.TargetWriter;
import com.intuitivedesigns.edgeforward.metrics.TargetMetricsProcessor;
import com.intuitivedesigns.edgeforward.metrics.TargetMetricsProvider;
import com.intuitivedesigns.edgeforward.spi.ServicePluginRegistry;
import com.intuitivedesigns.edgeforward.spi.WriterFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Lazily creates and caches the writers of the sub-targets a forwarder delivers to.
 *
 * <p>Each writer is constructed at most once, on first use, even when several forward attempts
 * ask for it at the same time. Inactive targets and writers that fail to construct resolve
 * to {@code null}; the caller treats that as a failed delivery.</p>
 */
public final class SubTargetRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SubTargetRegistry.class);

    /**
     * Builds the writer for one configured target.
     */
    @FunctionalInterface
    public interface WriterCreator {
        TargetWriter create(String targetId, TargetConfiguration target) throws Exception;
    }

    private final String ownerId;
    private final Map<String, TargetConfiguration> subTargets;
    private final WriterCreator creator;
    private final TargetMetricsProcessor metricsProcessor;

    private final ConcurrentHashMap<String, TargetWriter> writers = new ConcurrentHashMap<>();
    private final Set<String> reportedInactive = ConcurrentHashMap.newKeySet();

    public SubTargetRegistry(String ownerId,
                             Map<String, TargetConfiguration> subTargets,
                             WriterCreator creator,
                             TargetMetricsProcessor metricsProcessor) {
        this.ownerId = Objects.requireNonNull(ownerId, "ownerId");
        this.subTargets = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(subTargets, "subTargets")));
        this.creator = Objects.requireNonNull(creator, "creator");
        this.metricsProcessor = metricsProcessor;
    }

    /**
     * Looks up the configuration of every sub-target and checks that a writer type exists for it.
     *
     * @throws ConfigurationException for an unknown target id or a type without a {@link WriterFactory}
     */
    public static Map<String, TargetConfiguration> resolve(ForwarderConfig config,
                                                           Collection<String> targetIds,
                                                           ServicePluginRegistry<WriterFactory> factories) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(factories, "factories");

        final Map<String, TargetConfiguration> out = new LinkedHashMap<>();
        for (String id : targetIds) {
            final String typeKey = TargetConfiguration.key(id, TargetConfiguration.KEY_TYPE);
            final TargetConfiguration target = TargetConfiguration.find(config, id)
                    .orElseThrow(() -> new ConfigurationException("Unknown target '" + id + "', no '" + typeKey + "' configured", typeKey));

            if (factories.get(target.type()).isEmpty()) {
                throw new ConfigurationException("No writer available for '" + typeKey + "=" + target.type()
                        + "'. Available options: " + factories.availableIds(), typeKey);
            }
            out.put(id, target);
        }
        return out;
    }

    /**
     * @return the cached or newly created writer, or {@code null} if the target is unknown,
     * inactive, or its writer could not be created.
     */
    public TargetWriter getOrCreate(String targetId) {
        if (targetId == null) return null;

        final TargetWriter existing = writers.get(targetId);
        if (existing != null) return existing;

        final TargetConfiguration target = subTargets.get(targetId);
        if (target == null) {
            log.error("[{}] Target '{}' is not a sub-target of this writer", ownerId, targetId);
            return null;
        }
        if (!target.active()) {
            if (reportedInactive.add(targetId)) {
                log.warn("[{}] Target '{}' is not active, units routed to it fail", ownerId, targetId);
            }
            return null;
        }

        return writers.computeIfAbsent(targetId, id -> create(id, target));
    }

    private TargetWriter create(String targetId, TargetConfiguration target) {
        final TargetWriter writer;
        try {
            writer = creator.create(targetId, target);
        } catch (Exception e) {
            log.error("[{}] Failed to create writer for target '{}' (type {}): {}",
                    ownerId, targetId, target.type(), e.getMessage(), e);
            return null;
        }
        if (writer == null) {
            log.error("[{}] No writer created for target '{}' (type {})", ownerId, targetId, target.type());
            return null;
        }

        log.info("[{}] Created writer for target '{}' (type {})", ownerId, targetId, target.type());

        if (target.metricsEnabled() && metricsProcessor != null) {
            final TargetMetricsProvider provider = writer.metricsProvider();
            if (provider != null) {
                metricsProcessor.register(targetId, provider);
            }
        }
        return writer;
    }

    public Set<String> targetIds() {
        return subTargets.keySet();
    }

    public TargetConfiguration targetConfiguration(String targetId) {
        return subTargets.get(targetId);
    }

    /**
     * @return number of writers constructed so far.
     */
    public int size() {
        return writers.size();
    }

    /**
     * Closes every created writer. A failing writer does not prevent the others from closing.
     */
    public void closeAll() {
        final List<String> ids = new ArrayList<>(writers.keySet());
        for (String id : ids) {
            final TargetWriter w = writers.remove(id);
            if (w == null) continue;
            try {
                w.close();
                log.debug("[{}] Closed writer for target '{}'", ownerId, id);
            } catch (Exception e) {
                log.warn("[{}] Error closing writer for target '{}'", ownerId, id, e);
            }
        }
    }

    @Override
    public void close() {
        closeAll();
    }
}
