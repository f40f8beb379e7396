package com.baykanat.musicstream.api.controller;

import com.baykanat.musicstream.api.dto.RecommendationResponse;
import com.baykanat.musicstream.api.dto.TopGenresResponse;
import com.baykanat.musicstream.domain.service.RecommendationScorer;
import com.baykanat.musicstream.domain.service.UserProfileService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;

/** Kullanıcı bazlı okuma uçları: öneriler ve en çok dinlenen genre'ler. */
@Slf4j
@RestController
@RequestMapping("/users/{userId}")
@RequiredArgsConstructor
@Validated
@Tag(name = "Recommendations", description = "Per-user recommendations and listening profile")
public class RecommendationController {

    private final RecommendationScorer recommendationScorer;
    private final UserProfileService userProfileService;
    private final Clock clock;

    @GetMapping("/recommendations")
    @Operation(summary = "Recommend tracks", description = "Scores catalog candidates with the external model, excluding recently played tracks")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Recommendations generated"),
            @ApiResponse(responseCode = "404", description = "User has no listening history"),
            @ApiResponse(responseCode = "503", description = "Scoring model unavailable")
    })
    public ResponseEntity<RecommendationResponse> getRecommendations(
            @PathVariable("userId") String userId,
            @Parameter(description = "Maximum number of recommendations", example = "20")
            @RequestParam(value = "n", defaultValue = "20") @Min(1) @Max(200) int n
    ) {
        log.debug("Recommendation request: user_id={}, n={}", userId, n);
        return ResponseEntity.ok(RecommendationResponse.from(recommendationScorer.recommend(userId, n, clock.instant())));
    }

    @GetMapping("/top-genres")
    @Operation(summary = "Top genres by share of plays")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Genre shares computed"),
            @ApiResponse(responseCode = "404", description = "User has no listening history")
    })
    public ResponseEntity<TopGenresResponse> getTopGenres(
            @PathVariable("userId") String userId,
            @RequestParam(value = "limit", defaultValue = "5") @Min(1) @Max(100) int limit
    ) {
        TopGenresResponse response = TopGenresResponse.builder()
                .userId(userId)
                .genres(userProfileService.topGenres(userId, limit, clock.instant()).stream()
                        .map(g -> new TopGenresResponse.GenreEntry(g.getGenre(), g.getPlayCount(), g.getPercentage()))
                        .toList())
                .build();
        return ResponseEntity.ok(response);
    }
}
