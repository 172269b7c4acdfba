package io.tedge.actors;

import io.tedge.actors.config.SupervisionStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Applies the configured supervision strategy to actor failures and remembers the first one.
 */
final class Supervisor {
    private static final Logger logger = LoggerFactory.getLogger(Supervisor.class);

    private final SupervisionStrategy strategy;
    private ActorException firstFailure;

    Supervisor(SupervisionStrategy strategy) {
        this.strategy = strategy;
    }

    /**
     * Records a failure.
     */
    synchronized void onFailure(String task, ActorException failure) {
        if (firstFailure == null) {
            firstFailure = failure;
        } else if (firstFailure != failure) {
            firstFailure.addSuppressed(failure);
        }
        logger.debug("Recorded failure of {}", task);
    }

    /**
     * @param task the failing actor
     * @return true if all other actors must be asked to shut down
     */
    boolean escalates(String task) {
        switch (strategy) {
            case SHUTDOWN_ALL:
                logger.info("Escalating failure of {}, shutting down all actors", task);
                return true;
            case ISOLATE:
                logger.info("Isolating failure of {}, other actors keep running", task);
                return false;
            default:
                throw new IllegalStateException("Unknown supervision strategy: " + strategy);
        }
    }

    synchronized Optional<ActorException> firstFailure() {
        return Optional.ofNullable(firstFailure);
    }
}
