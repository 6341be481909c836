package dev.factories.error;

import java.util.List;

/**
 * A recipe file was found but could not be parsed or failed validation.
 */
public class RecipeValidationException extends FactoryException {

    private final String recipeName;
    private final List<String> errors;

    public RecipeValidationException(String recipeName, List<String> errors) {
        super("Recipe '%s' is invalid: %s".formatted(recipeName, String.join("; ", errors)));
        this.recipeName = recipeName;
        this.errors = List.copyOf(errors);
    }

    public RecipeValidationException(String recipeName, String error, Throwable cause) {
        super("Recipe '%s' is invalid: %s".formatted(recipeName, error), cause);
        this.recipeName = recipeName;
        this.errors = List.of(error);
    }

    public String recipeName() { return recipeName; }
    public List<String> errors() { return errors; }
}
