package com.govdata.discovery.validation;

import com.govdata.discovery.recommendation.RecommendationModels.RecommendationKind;
import com.govdata.discovery.recommendation.RecommendationModels.RecommendationRequest;
import com.govdata.discovery.validation.RequestValidator.ValidationError;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RequestValidatorTest {
    private final RequestValidator validator = new RequestValidator();

    @Test
    void recommendationErrorsNameTheMissingParameter() {
        assertEquals(List.of("type"), fields(validator.validateRecommendation(
                new RecommendationRequest(RecommendationKind.fromValue("popular"), null, null, null, null, null, 5))));
        assertEquals(List.of("datasetId"), fields(validator.validateRecommendation(
                new RecommendationRequest(RecommendationKind.RELATED, null, null, null, null, null, 5))));
        assertEquals(List.of("datasetIds", "limit"), fields(validator.validateRecommendation(
                new RecommendationRequest(RecommendationKind.COMPLEMENTARY, null, null, null, null, null, -1))));
        assertTrue(validator.validateRecommendation(
                new RecommendationRequest(RecommendationKind.SEARCH, null, null, null, null, null, 5)).isEmpty());
    }

    @Test
    void kindParsingIsCaseInsensitive() {
        assertEquals(RecommendationKind.TRENDING, RecommendationKind.fromValue(" Trending "));
        assertNull(RecommendationKind.fromValue(null));
    }

    @Test
    void requireValidThrowsWithAllErrors() {
        InvalidRequestException ex = assertThrows(InvalidRequestException.class,
                () -> validator.requireValid(validator.validatePage(0, -3)));
        assertEquals(2, ex.getErrors().size());
        validator.requireValid(validator.validateSearch("housing"));
    }

    private List<String> fields(List<ValidationError> errors) {
        return errors.stream().map(ValidationError::field).toList();
    }
}
