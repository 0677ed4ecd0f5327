package org.carball.pvadvisor.ai;

/**
 * Transport to an external text-generation service. Sends exactly one request per call.
 */
public interface GenerationClient {

    /**
     * @return the raw text produced by the service
     */
    String complete(String prompt) throws GenerationException;
}
