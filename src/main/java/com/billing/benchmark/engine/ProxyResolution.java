package com.billing.benchmark.engine;

import com.billing.benchmark.model.ProxyMethod;

/**
 * Outcome of proxy resolution for one group.
 *
 * @param equalChargesCount lines whose allowed amount equals their charges
 * @param decontaminated    whether the allowed == charges filter was in effect
 */
public record ProxyResolution(double value, ProxyMethod method, int equalChargesCount, boolean decontaminated) {
}
