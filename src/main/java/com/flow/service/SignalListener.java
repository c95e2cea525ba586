package com.flow.service;

import com.flow.engine.Signal;

/**
 * Downstream consumer of emitted signals (alerting, paper trading, display).
 * Called on the evaluation thread; implementations should hand off slow work.
 */
@FunctionalInterface
public interface SignalListener {

    void onSignal(Signal signal);
}
