package com.caserag.runtime;

public class EngineNotInitializedException extends IllegalStateException {
    public EngineNotInitializedException() {
        super("Case engine not initialized. Call initialize() first.");
    }
}
