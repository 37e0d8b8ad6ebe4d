package com.cabbooking.api_gateway.loadbalancer;

import com.cabbooking.api_gateway.registry.Instance;

/**
 * Picks the instance the next request for a service should go to.
 *
 * Implementations only ever return instances whose health flag is set, return
 * null when none is healthy, and must be safe to call from many request threads
 * at once.
 */
public interface InstanceSelector {

    /**
     * @return the next healthy instance, or null if the service has none right now
     */
    Instance next();
}
