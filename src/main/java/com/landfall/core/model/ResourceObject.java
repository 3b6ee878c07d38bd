package com.landfall.core.model;

/**
 * The minimal view Landfall needs of a Kubernetes object: its kind, its name,
 * its namespace and a body that serializes to the object's JSON manifest.
 *
 * <p>Implementations are treated as read-only.
 */
public interface ResourceObject {

    String DEFAULT_NAMESPACE = "default";

    String kind();

    String name();

    /**
     * The namespace as declared, possibly empty for cluster defaults.
     */
    String namespace();

    /**
     * The value serialized into the manifest archive.
     */
    Object body();

    /**
     * The namespace the object lands in once applied: the declared one, or {@code default}.
     */
    default String effectiveNamespace() {
        var ns = namespace();
        return ns == null || ns.isBlank() ? DEFAULT_NAMESPACE : ns;
    }

    default String describe() {
        return kind() + "/" + name() + " in namespace " + effectiveNamespace();
    }
}
