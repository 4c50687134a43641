package com.billing.benchmark.engine;

import com.billing.benchmark.model.ProxyMethod;

public record ProxySelection(double value, ProxyMethod method) {
}
