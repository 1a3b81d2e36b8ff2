package com.github.seamorder.atsp;

/**
 * Thrown when a {@link CostMatrix} cannot be turned into a model.
 */
public class FormulationException extends IllegalArgumentException {
    /**
     * @param message detail message
     */
    public FormulationException(String message) {
        super(message);
    }
}
