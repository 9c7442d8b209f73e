package com.govdata.discovery.validation;

import com.govdata.discovery.recommendation.RecommendationModels.RecommendationKind;
import com.govdata.discovery.recommendation.RecommendationModels.RecommendationRequest;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class RequestValidator {
    static final int MAX_PAGE_SIZE = 200;

    public List<ValidationError> validateSearch(String text) {
        List<ValidationError> errors = new ArrayList<>();
        if (text == null || text.isBlank()) {
            errors.add(new ValidationError("MISSING_QUERY", "Query parameter is required", "q"));
        }
        return errors;
    }

    public List<ValidationError> validateRecommendation(RecommendationRequest request) {
        List<ValidationError> errors = new ArrayList<>();
        if (request == null || request.kind() == null) {
            errors.add(new ValidationError("INVALID_TYPE", "Invalid recommendation type", "type"));
            return errors;
        }
        if (request.kind() == RecommendationKind.RELATED && isBlank(request.datasetId())) {
            errors.add(new ValidationError("MISSING_DATASET_ID", "datasetId is required for related recommendations", "datasetId"));
        }
        if (request.kind() == RecommendationKind.COMPLEMENTARY && request.datasetIds().isEmpty()) {
            errors.add(new ValidationError("MISSING_DATASET_IDS", "datasetIds are required for complementary recommendations", "datasetIds"));
        }
        if (request.limit() <= 0) {
            errors.add(new ValidationError("INVALID_LIMIT", "limit must be positive", "limit"));
        }
        return errors;
    }

    public List<ValidationError> validatePage(int limit, int offset) {
        List<ValidationError> errors = new ArrayList<>();
        if (limit <= 0 || limit > MAX_PAGE_SIZE) {
            errors.add(new ValidationError("INVALID_LIMIT", "limit must be between 1 and " + MAX_PAGE_SIZE, "limit"));
        }
        if (offset < 0) {
            errors.add(new ValidationError("INVALID_OFFSET", "offset must not be negative", "offset"));
        }
        return errors;
    }

    public void requireValid(List<ValidationError> errors) {
        if (!errors.isEmpty()) {
            throw new InvalidRequestException(errors);
        }
    }

    private boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public record ValidationError(String code, String message, String field) {}
}
