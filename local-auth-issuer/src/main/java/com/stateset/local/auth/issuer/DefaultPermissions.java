package com.stateset.local.auth.issuer;

import java.util.Arrays;
import java.util.List;

/**
 * Every permission the API knows about, grouped by resource. Each resource
 * group ends with its wildcard.
 */
public final class DefaultPermissions {

    public static final List<String> ORDERS = List.of(
        "orders:read",
        "orders:create",
        "orders:update",
        "orders:delete",
        "orders:cancel",
        "orders:*");

    public static final List<String> INVENTORY = List.of(
        "inventory:read",
        "inventory:adjust",
        "inventory:transfer",
        "inventory:*");

    public static final List<String> RETURNS = List.of(
        "returns:read",
        "returns:create",
        "returns:approve",
        "returns:reject",
        "returns:*");

    public static final List<String> SHIPMENTS = List.of(
        "shipments:read",
        "shipments:create",
        "shipments:update",
        "shipments:delete",
        "shipments:*");

    public static final List<String> WARRANTIES = List.of(
        "warranties:read",
        "warranties:create",
        "warranties:update",
        "warranties:delete",
        "warranties:*");

    public static final List<String> WORK_ORDERS = List.of(
        "workorders:read",
        "workorders:create",
        "workorders:update",
        "workorders:delete",
        "workorders:*");

    public static final List<String> MISC = List.of(
        "admin:outbox",
        "payments:access",
        "agents:access");

    public static final List<String> ALL = concat(
        ORDERS, INVENTORY, RETURNS, SHIPMENTS, WARRANTIES, WORK_ORDERS, MISC);

    private DefaultPermissions() {}

    @SafeVarargs
    private static List<String> concat(List<String>... groups) {
        return Arrays.stream(groups).flatMap(List::stream).toList();
    }
}
