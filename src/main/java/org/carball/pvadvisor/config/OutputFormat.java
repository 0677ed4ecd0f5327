package org.carball.pvadvisor.config;

public enum OutputFormat {
    JSON,
    MARKDOWN,
    BOTH
}
