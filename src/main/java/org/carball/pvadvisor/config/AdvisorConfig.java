package org.carball.pvadvisor.config;

import lombok.Data;

import java.nio.file.Path;

@Data
public class AdvisorConfig {
    private Path inputFile;
    private String outputFile;
    private OutputFormat outputFormat;
    private String locale;
    private boolean verbose;
    private GatewayConfig gatewayConfig;
}
