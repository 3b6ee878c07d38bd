package com.landfall.stability;

import com.landfall.core.LandfallException;
import com.landfall.core.model.ResourceObject;

/**
 * Thrown when an object did not reach a stable state.
 *
 * <p>Carries the first failing object; {@link #getAdditionalFailures()} counts
 * sibling checks that also failed but are not reported here.
 */
public class UnstableResourceException extends LandfallException {

    private final String kind;
    private final String name;
    private final String namespace;
    private final int additionalFailures;

    public UnstableResourceException(ResourceObject object, int additionalFailures, Throwable cause) {
        super(message(object, additionalFailures, cause), cause);
        this.kind = object.kind();
        this.name = object.name();
        this.namespace = object.effectiveNamespace();
        this.additionalFailures = additionalFailures;
    }

    public String getKind() {
        return kind;
    }

    public String getName() {
        return name;
    }

    public String getNamespace() {
        return namespace;
    }

    public int getAdditionalFailures() {
        return additionalFailures;
    }

    private static String message(ResourceObject object, int additionalFailures, Throwable cause) {
        var message = "waiting for %s to be stable: %s".formatted(object.describe(), cause.getMessage());
        if (additionalFailures > 0) {
            message += " (%d more object%s also failed)".formatted(additionalFailures, additionalFailures == 1 ? "" : "s");
        }
        return message;
    }
}
