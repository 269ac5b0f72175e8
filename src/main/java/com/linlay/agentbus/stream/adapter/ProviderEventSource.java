package com.linlay.agentbus.stream.adapter;

import reactor.core.Disposable;

import java.util.function.Consumer;

/**
 * Push-style provider emitter. Listeners may be invoked from any provider thread.
 */
@FunctionalInterface
public interface ProviderEventSource {

    Disposable listen(Consumer<NativeEvent> listener);
}
