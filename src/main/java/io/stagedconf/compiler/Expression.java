package io.stagedconf.compiler;

import io.stagedconf.error.ConfigObjectException;
import io.stagedconf.object.model.ActivationContext;

/**
 * Compiled unit of configuration.
 */
@FunctionalInterface
public interface Expression {

    /**
     * Evaluates the unit, adding every object definition it contains to {@code context}.
     */
    void evaluate(ActivationContext context) throws ConfigObjectException;
}
