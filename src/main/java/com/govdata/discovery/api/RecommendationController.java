package com.govdata.discovery.api;

import com.govdata.discovery.recommendation.RecommendationModels.RecommendationKind;
import com.govdata.discovery.recommendation.RecommendationModels.RecommendationRequest;
import com.govdata.discovery.recommendation.RecommendationModels.RecommendationResponse;
import com.govdata.discovery.recommendation.RecommendationService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Arrays;
import java.util.List;

@RestController
@RequestMapping("/api/recommendations")
public class RecommendationController {
    private final RecommendationService recommendationService;
    private final int defaultLimit;

    public RecommendationController(RecommendationService recommendationService,
                                    @Value("${recommendation.default-limit:5}") int defaultLimit) {
        this.recommendationService = recommendationService;
        this.defaultLimit = defaultLimit;
    }

    @GetMapping
    public ResponseEntity<RecommendationResponse> recommend(@RequestParam(required = false) String type,
                                                            @RequestParam(required = false) String datasetId,
                                                            @RequestParam(required = false) String query,
                                                            @RequestParam(required = false) String domains,
                                                            @RequestParam(required = false) String keywords,
                                                            @RequestParam(required = false) String datasetIds,
                                                            @RequestParam(required = false) Integer limit) {
        RecommendationRequest request = new RecommendationRequest(
                RecommendationKind.fromValue(type),
                datasetId,
                query,
                parseCsv(domains),
                parseCsv(keywords),
                parseCsv(datasetIds),
                limit == null ? defaultLimit : limit);
        return ResponseEntity.ok(recommendationService.recommend(request));
    }

    private List<String> parseCsv(String csv) {
        if (csv == null || csv.isBlank()) return List.of();
        return Arrays.stream(csv.split(",")).map(String::trim).filter(s -> !s.isEmpty()).distinct().toList();
    }
}
