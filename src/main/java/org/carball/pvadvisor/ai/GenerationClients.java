package org.carball.pvadvisor.ai;

import org.carball.pvadvisor.config.GatewayConfig;

public final class GenerationClients {

    private GenerationClients() {
    }

    public static GenerationClient create(GatewayConfig config) {
        if (config.isOpenAi()) {
            return new OpenAiGenerationClient(config);
        }
        return new CallAiGenerationClient(config);
    }
}
