package com.droidassist.service;

public class UnknownScenarioException extends RuntimeException {

    public UnknownScenarioException(String scenario) {
        super("Unknown scenario: " + scenario);
    }
}
