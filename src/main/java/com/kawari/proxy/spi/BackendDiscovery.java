package com.kawari.proxy.spi;

import com.kawari.proxy.core.rotation.BackendDescriptor;
import java.util.List;

/**
 * Source of candidate egress backends.
 */
public interface BackendDiscovery {
    /**
     * Enumerates candidate backends.
     *
     * @param limit  maximum number of backends to return, {@code 0} for no limit.
     * @param verify whether to probe each candidate before returning it.
     * @return unique backends in discovery order.
     * @throws InterruptedException if interrupted while fetching or verifying.
     */
    List<BackendDescriptor> discover(int limit, boolean verify) throws InterruptedException;
}
