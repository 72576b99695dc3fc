/**
 * REST controller ranking the plant catalog against a garden-design brief.
 */
package net.plantmatch.controller;

import lombok.extern.slf4j.Slf4j;
import net.plantmatch.application.recommendation.PlantRecommendationResponseUseCase;
import net.plantmatch.controller.dto.PlantRecommendationResponse;
import net.plantmatch.service.CriteriaOptions;
import net.plantmatch.service.RecommendationService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.util.MultiValueMap;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/plant-recommendations")
@Slf4j
public class PlantRecommendationController {

    private final RecommendationService recommendationService;
    private final PlantRecommendationResponseUseCase responseUseCase;

    public PlantRecommendationController(RecommendationService recommendationService,
                                         PlantRecommendationResponseUseCase responseUseCase) {
        this.recommendationService = recommendationService;
        this.responseUseCase = responseUseCase;
    }

    /**
     * Ranks plants against the criteria in the JSON body.
     */
    @PostMapping
    public Mono<ResponseEntity<PlantRecommendationResponse>> recommend(
            @RequestBody(required = false) Map<String, Object> criteria) {
        if (criteria == null || criteria.isEmpty()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                "Request body with recommendation criteria is required");
        }
        return recommendationService.recommendAsync(criteria)
            .map(responseUseCase::toResponse)
            .map(ResponseEntity::ok);
    }

    /**
     * Ranks plants against criteria sent as query parameters; repeated parameters form a list.
     */
    @GetMapping
    public Mono<ResponseEntity<PlantRecommendationResponse>> recommendFromQuery(
            @RequestParam MultiValueMap<String, String> params) {
        return recommendationService.recommendAsync(flatten(params))
            .map(responseUseCase::toResponse)
            .map(ResponseEntity::ok);
    }

    @GetMapping("/criteria-options")
    public Mono<ResponseEntity<CriteriaOptions>> criteriaOptions() {
        return Mono.fromCallable(recommendationService::criteriaOptions)
            .subscribeOn(Schedulers.boundedElastic())
            .map(ResponseEntity::ok);
    }

    private static Map<String, Object> flatten(MultiValueMap<String, String> params) {
        Map<String, Object> criteria = new LinkedHashMap<>();
        params.forEach((key, values) -> {
            if (values == null || values.isEmpty()) {
                return;
            }
            criteria.put(key, values.size() == 1 ? values.get(0) : List.copyOf(values));
        });
        log.debug("Recommendation query parameters: {}", criteria.keySet());
        return criteria;
    }
}
