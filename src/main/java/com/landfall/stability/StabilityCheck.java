package com.landfall.stability;

import com.landfall.core.model.ClusterHandle;
import com.landfall.core.model.ResourceObject;
import com.landfall.runcommand.CancellationToken;

/**
 * Confirms one object is stable on the cluster, throwing if it is not.
 */
@FunctionalInterface
public interface StabilityCheck {

    void verify(ClusterHandle cluster, ResourceObject object, CancellationToken cancellation);
}
