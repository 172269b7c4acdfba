package io.tedge.actors.config;

/**
 * What the runtime does when an actor fails.
 */
public enum SupervisionStrategy {
    /**
     * Request every other actor to shut down. The first failure is reported once all actors have
     * stopped or the cleanup timeout expired.
     */
    SHUTDOWN_ALL,

    /**
     * Let the other actors run. Failures are still reported when the runtime completes.
     */
    ISOLATE
}
