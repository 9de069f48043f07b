package com.example.coverage.config;

public class UnknownTenantException extends RuntimeException {

    public UnknownTenantException(String tenant) {
        super("No vocabulary configured for tenant '" + tenant + "'");
    }
}
