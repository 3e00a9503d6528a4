package dev.pagecraft.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import dev.pagecraft.exception.ValidationException;

/**
 * Typed access to the JSON object of arguments passed to a named operation.
 * Every accessor fails with {@link ValidationException} on a missing required
 * value or a value of the wrong JSON type.
 */
public final class OperationArguments {

    private final JsonNode node;
    private final IdService idService;

    public OperationArguments(JsonNode node, IdService idService) {
        if (node != null && !node.isNull() && !node.isObject()) {
            throw new ValidationException("Operation arguments must be a JSON object");
        }
        this.node = node == null ? NullNode.getInstance() : node;
        this.idService = idService;
    }

    /**
     * Ids are accepted as JSON integers or as decimal strings.
     */
    public Long requiredId(String name) {
        Long id = optionalId(name);
        if (id == null) {
            throw missing(name);
        }
        return id;
    }

    public Long optionalId(String name) {
        JsonNode value = value(name);
        if (value == null) {
            return null;
        }
        if (value.isIntegralNumber() && value.canConvertToLong()) {
            return value.longValue();
        }
        if (value.isTextual()) {
            return idService.fromString(value.textValue());
        }
        throw wrongType(name, "an id");
    }

    public String requiredString(String name) {
        String text = optionalString(name);
        if (text == null) {
            throw missing(name);
        }
        return text;
    }

    public String optionalString(String name) {
        JsonNode value = value(name);
        if (value == null) {
            return null;
        }
        if (!value.isTextual()) {
            throw wrongType(name, "a string");
        }
        return value.textValue();
    }

    public Integer requiredInt(String name) {
        Integer number = optionalInt(name);
        if (number == null) {
            throw missing(name);
        }
        return number;
    }

    public Integer optionalInt(String name) {
        JsonNode value = value(name);
        if (value == null) {
            return null;
        }
        if (!value.isIntegralNumber() || !value.canConvertToInt()) {
            throw wrongType(name, "an integer");
        }
        return value.intValue();
    }

    // explicit JSON null counts as absent
    private JsonNode value(String name) {
        JsonNode value = node.get(name);
        return value == null || value.isNull() ? null : value;
    }

    private static ValidationException missing(String name) {
        return new ValidationException("Missing required argument: " + name);
    }

    private static ValidationException wrongType(String name, String expected) {
        return new ValidationException("Argument '" + name + "' must be " + expected);
    }
}
