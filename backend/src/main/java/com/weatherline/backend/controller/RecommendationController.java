package com.weatherline.backend.controller;

import com.weatherline.backend.recommendation.Recommendation;
import com.weatherline.backend.recommendation.RecommendationRequest;
import com.weatherline.backend.recommendation.WeatherProductionRecommender;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/recommendations")
@Tag(name = "Recommendations", description = "Weather-based production parameter recommendations")
public class RecommendationController {

    private final WeatherProductionRecommender recommender;

    public RecommendationController(WeatherProductionRecommender recommender) {
        this.recommender = recommender;
    }

    @PostMapping
    @Operation(summary = "Recommend parameters",
            description = "Dryer temperature, pre-mix adjustment and hold/release for the given site conditions. "
                    + "Evaluation errors produce a low-confidence fallback rather than an error response.")
    public ResponseEntity<Recommendation> recommend(@RequestBody RecommendationRequest request) {
        return ResponseEntity.ok(recommender.recommend(request));
    }
}
