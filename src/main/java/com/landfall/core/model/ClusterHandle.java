package com.landfall.core.model;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Identifies the managed cluster Landfall deploys to.
 *
 * @param name           cluster name
 * @param subscriptionId subscription that owns the cluster
 * @param resourceGroup  resource group that holds the cluster
 * @param id             full resource id, used to address the cluster's run-command endpoint
 */
public record ClusterHandle(String name, String subscriptionId, String resourceGroup, String id) {

    private static final Pattern RESOURCE_ID = Pattern.compile(
            "^/subscriptions/([^/]+)/resourceGroups/([^/]+)/providers/Microsoft\\.ContainerService/managedClusters/([^/]+)/?$",
            Pattern.CASE_INSENSITIVE);

    public ClusterHandle {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(subscriptionId, "subscriptionId");
        Objects.requireNonNull(resourceGroup, "resourceGroup");
        Objects.requireNonNull(id, "id");
    }

    /**
     * Builds a handle from its parts, deriving the resource id.
     */
    public static ClusterHandle of(String subscriptionId, String resourceGroup, String name) {
        var id = "/subscriptions/%s/resourceGroups/%s/providers/Microsoft.ContainerService/managedClusters/%s"
                .formatted(subscriptionId, resourceGroup, name);
        return new ClusterHandle(name, subscriptionId, resourceGroup, id);
    }

    /**
     * Parses a managed-cluster resource id such as
     * {@code /subscriptions/<sub>/resourceGroups/<rg>/providers/Microsoft.ContainerService/managedClusters/<name>}.
     *
     * @throws IllegalArgumentException if the id does not address a managed cluster
     */
    public static ClusterHandle fromResourceId(String resourceId) {
        if (resourceId == null || resourceId.isBlank()) {
            throw new IllegalArgumentException("cluster resource id is empty");
        }
        var trimmed = resourceId.trim();
        var matcher = RESOURCE_ID.matcher(trimmed);
        if (!matcher.matches()) {
            throw new IllegalArgumentException("not a managed cluster resource id: " + resourceId);
        }
        var id = trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
        return new ClusterHandle(matcher.group(3), matcher.group(1), matcher.group(2), id);
    }
}
