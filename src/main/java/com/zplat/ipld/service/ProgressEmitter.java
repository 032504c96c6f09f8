package com.zplat.ipld.service;

/**
 * Push-style sink for run progress. Each payload is a full snapshot, never a delta.
 */
@FunctionalInterface
public interface ProgressEmitter {
    void emit(String event, Object payload);
}
