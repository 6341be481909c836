package dev.factories.error;

/**
 * A recipe, instance or discovery record that was asked for does not exist.
 */
public class NotFoundException extends FactoryException {

    public NotFoundException(String message) {
        super(message);
    }
}
