package org.example.campusschedule.validation;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import org.example.campusschedule.exception.ClientValidationException;
import org.example.campusschedule.model.BaseDocument;
import org.example.campusschedule.model.DocumentKind;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Checks a document against the constraints declared on its kind's class.
 * Has no store dependency; services call it before every write.
 */
@Component
@RequiredArgsConstructor
public class DocumentValidator {

    private final Validator validator;

    public <T extends BaseDocument> void validate(DocumentKind<T> kind, T record) {
        if (record == null) {
            throw new ClientValidationException(kind.collection(), List.of("record: must not be null"));
        }
        Set<ConstraintViolation<T>> violations = validator.validate(record);
        if (!violations.isEmpty()) {
            List<String> errors = violations.stream()
                    .map(v -> v.getPropertyPath() + ": " + v.getMessage())
                    .sorted()
                    .collect(Collectors.toList());
            throw new ClientValidationException(kind.collection(), errors);
        }
    }

    /**
     * Validates the values of a partial update against the constraints of the same properties on the kind's class.
     */
    public <T extends BaseDocument> void validateValues(DocumentKind<T> kind, Map<String, Object> values) {
        List<String> errors = new ArrayList<>();
        values.forEach((property, value) -> validator.validateValue(kind.type(), property, value)
                .forEach(v -> errors.add(property + ": " + v.getMessage())));
        if (!errors.isEmpty()) {
            errors.sort(null);
            throw new ClientValidationException(kind.collection(), errors);
        }
    }
}
