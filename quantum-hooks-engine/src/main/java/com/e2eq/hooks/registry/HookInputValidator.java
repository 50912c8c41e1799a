package com.e2eq.hooks.registry;

import com.e2eq.hooks.exceptions.HookInputValidationException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.hibernate.validator.messageinterpolation.ParameterMessageInterpolator;

import java.util.Map;
import java.util.Set;

/**
 * Binds a raw hook payload to the hook's input record and validates it.
 * The normalized payload (unknown fields dropped, absent optionals omitted) is what
 * scripts receive as {@code context}.
 */
@ApplicationScoped
public class HookInputValidator {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final Validator validator;

    @Inject
    public HookInputValidator(ObjectMapper objectMapper) {
        this(objectMapper, buildValidator());
    }

    public HookInputValidator(ObjectMapper objectMapper, Validator validator) {
        this.objectMapper = objectMapper;
        this.validator = validator;
    }

    private static Validator buildValidator() {
        ValidatorFactory factory = Validation.byDefaultProvider()
                .configure()
                .messageInterpolator(new ParameterMessageInterpolator())
                .buildValidatorFactory();
        return factory.getValidator();
    }

    /**
     * @return the normalized payload as a JSON-compatible map
     * @throws HookInputValidationException when the payload cannot be bound or violates a constraint
     */
    public Map<String, Object> validate(HookDefinition definition, Object input) {
        if (input == null) {
            throw new HookInputValidationException(definition.name(),
                    "Invalid input for hook " + definition.name() + ": payload is required", null);
        }
        Object bound;
        try {
            bound = objectMapper.convertValue(input, definition.inputType());
        } catch (IllegalArgumentException e) {
            throw new HookInputValidationException(definition.name(),
                    "Invalid input for hook " + definition.name() + ": " + e.getMessage(), e);
        }
        Set<ConstraintViolation<Object>> violations = validator.validate(bound);
        if (!violations.isEmpty()) {
            throw new HookInputValidationException(definition.name(), violations);
        }
        return objectMapper.convertValue(bound, MAP_TYPE);
    }
}
