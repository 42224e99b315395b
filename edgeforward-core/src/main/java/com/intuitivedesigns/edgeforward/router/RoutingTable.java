/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.edgeforward.router;

import com.intuitivedesigns.edgeforward.config.ConfigurationException;
import com.intuitivedesigns.edgeforward.config.ForwarderConfig;
import com.intuitivedesigns.edgeforward.config.TargetConfiguration;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Read-only routing of a router: its routes in configuration order plus the aggregation policy.
 *
 * <pre>
 * router.plant-router.policy=ANY_TARGET
 * router.plant-router.routes=kafka-out,log-out
 * router.plant-router.route.kafka-out.success=archive
 * router.plant-router.route.kafka-out.alternate=backup
 * </pre>
 */
public final class RoutingTable {

    public static final String PREFIX = "router.";

    private final String routerId;
    private final AggregationPolicy policy;
    private final Map<String, Route> routes;

    private RoutingTable(String routerId, AggregationPolicy policy, Map<String, Route> routes) {
        this.routerId = routerId;
        this.policy = policy;
        this.routes = Collections.unmodifiableMap(routes);
        validate();
    }

    public static String key(String routerId, String name) {
        return PREFIX + routerId + "." + name;
    }

    /**
     * Reads the routing of {@code routerId} and checks that every target it names is configured.
     *
     * @throws ConfigurationException if the routing is missing, refers to unknown targets, or loops
     */
    public static RoutingTable fromConfig(ForwarderConfig config, String routerId) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(routerId, "routerId");

        final String policyKey = key(routerId, "policy");
        final Builder b = builder(routerId)
                .policy(AggregationPolicy.parse(config.getString(policyKey, null), policyKey));

        for (String primary : config.getList(key(routerId, "routes"))) {
            b.route(primary,
                    config.getString(key(routerId, "route." + primary + ".success"), null),
                    config.getString(key(routerId, "route." + primary + ".alternate"), null));
        }

        final RoutingTable table = b.build();

        final Set<String> known = TargetConfiguration.all(config).keySet();
        for (String id : table.subTargetIds()) {
            ConfigurationException.check(known.contains(id),
                    "Router '" + routerId + "' routes to unknown target '" + id + "'",
                    TargetConfiguration.key(id, TargetConfiguration.KEY_TYPE));
        }
        return table;
    }

    private void validate() {
        final String routesKey = key(routerId, "routes");
        ConfigurationException.check(!routes.isEmpty(), "Router '" + routerId + "' has no routes", routesKey);

        for (Route r : routes.values()) {
            ConfigurationException.check(!r.primary().equals(routerId),
                    "Router '" + routerId + "' cannot route to itself", routesKey);

            checkSecondary(r.primary(), r.success(), "success");
            checkSecondary(r.primary(), r.alternate(), "alternate");
        }
    }

    private void checkSecondary(String primary, String target, String kind) {
        if (target == null) return;
        final String k = key(routerId, "route." + primary + "." + kind);
        ConfigurationException.check(!target.equals(routerId),
                "Router '" + routerId + "' cannot use itself as " + kind + " target of '" + primary + "'", k);
    }

    public String routerId() {
        return routerId;
    }

    public AggregationPolicy policy() {
        return policy;
    }

    public List<Route> routes() {
        return List.copyOf(routes.values());
    }

    /**
     * @return the route whose primary is {@code targetId}, or null
     */
    public Route route(String targetId) {
        return targetId == null ? null : routes.get(targetId);
    }

    public boolean isPrimary(String targetId) {
        return targetId != null && routes.containsKey(targetId);
    }

    public Set<String> primaryTargetIds() {
        return routes.keySet();
    }

    /**
     * @return primaries, then success and alternate targets, without duplicates
     */
    public Set<String> subTargetIds() {
        final Set<String> ids = new LinkedHashSet<>(routes.keySet());
        for (Route r : routes.values()) {
            if (r.hasSuccess()) ids.add(r.success());
            if (r.hasAlternate()) ids.add(r.alternate());
        }
        return Collections.unmodifiableSet(ids);
    }

    public boolean hasSuccessRoutes() {
        return routes.values().stream().anyMatch(Route::hasSuccess);
    }

    public boolean hasAlternateRoutes() {
        return routes.values().stream().anyMatch(Route::hasAlternate);
    }

    @Override
    public String toString() {
        return "RoutingTable{router=" + routerId + ", policy=" + policy + ", routes=" + routes.values() + "}";
    }

    public static Builder builder(String routerId) {
        return new Builder(routerId);
    }

    public static final class Builder {
        private final String routerId;
        private AggregationPolicy policy = AggregationPolicy.ALL_TARGETS;
        private final List<Route> routes = new ArrayList<>();

        private Builder(String routerId) {
            this.routerId = Objects.requireNonNull(routerId, "routerId");
        }

        public Builder policy(AggregationPolicy policy) {
            this.policy = Objects.requireNonNull(policy, "policy");
            return this;
        }

        public Builder route(String primary) {
            return route(primary, null, null);
        }

        public Builder route(String primary, String success, String alternate) {
            routes.add(new Route(primary, success, alternate));
            return this;
        }

        public RoutingTable build() {
            final Map<String, Route> byPrimary = new LinkedHashMap<>();
            for (Route r : routes) {
                if (byPrimary.putIfAbsent(r.primary(), r) != null) {
                    throw new ConfigurationException("Router '" + routerId + "' lists primary target '"
                            + r.primary() + "' more than once", key(routerId, "routes"));
                }
            }
            return new RoutingTable(routerId, policy, byPrimary);
        }
    }
}
