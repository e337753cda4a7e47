package com.aicli.isolation.config;

import com.aicli.isolation.IsolationException;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Holder for the current {@link IsolationConfig}. Readers always see one complete config;
 * updates swap the whole record.
 */
public class IsolationPolicy {

    private final AtomicReference<IsolationConfig> current;

    public IsolationPolicy(IsolationConfig config) {
        this.current = new AtomicReference<>(config != null ? config : IsolationConfig.defaults());
    }

    public static IsolationPolicy defaults() {
        return new IsolationPolicy(IsolationConfig.defaults());
    }

    public IsolationConfig current() {
        return current.get();
    }

    public void replace(IsolationConfig config) {
        if (config == null) {
            throw IsolationException.invalidInput("config cannot be nil");
        }
        current.set(config);
    }
}
