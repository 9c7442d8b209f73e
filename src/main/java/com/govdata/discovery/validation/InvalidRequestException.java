package com.govdata.discovery.validation;

import com.govdata.discovery.validation.RequestValidator.ValidationError;

import java.util.List;

public class InvalidRequestException extends RuntimeException {
    private final List<ValidationError> errors;

    public InvalidRequestException(List<ValidationError> errors) {
        super(errors.isEmpty() ? "Invalid request" : errors.get(0).message());
        this.errors = List.copyOf(errors);
    }

    public List<ValidationError> getErrors() {
        return errors;
    }
}
