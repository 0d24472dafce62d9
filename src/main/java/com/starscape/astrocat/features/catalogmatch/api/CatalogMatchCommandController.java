package com.starscape.astrocat.features.catalogmatch.api;

import com.starscape.astrocat.common.progress.BulkProgress;
import com.starscape.astrocat.features.catalogmatch.api.dto.AddManualMatchRequest;
import com.starscape.astrocat.features.catalogmatch.api.dto.BulkMatchRequest;
import com.starscape.astrocat.features.catalogmatch.api.dto.ManualMatchResponse;
import com.starscape.astrocat.features.catalogmatch.api.dto.RecomputeMatchesResponse;
import com.starscape.astrocat.features.catalogmatch.app.AddManualMatchHandler;
import com.starscape.astrocat.features.catalogmatch.app.BulkMatchHandler;
import com.starscape.astrocat.features.catalogmatch.app.CatalogMatcher;
import com.starscape.astrocat.features.catalogmatch.app.MatchOutcome;
import com.starscape.astrocat.features.catalogmatch.domain.CatalogMatch;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/commands")
public class CatalogMatchCommandController {

    private final CatalogMatcher catalogMatcher;
    private final AddManualMatchHandler addManualMatchHandler;
    private final BulkMatchHandler bulkMatchHandler;

    public CatalogMatchCommandController(
            CatalogMatcher catalogMatcher,
            AddManualMatchHandler addManualMatchHandler,
            BulkMatchHandler bulkMatchHandler) {
        this.catalogMatcher = catalogMatcher;
        this.addManualMatchHandler = addManualMatchHandler;
        this.bulkMatchHandler = bulkMatchHandler;
    }

    /**
     * Recompute the automatic matches of one image.
     * POST /commands/images/{imageId}/matches/recompute
     */
    @PostMapping("/images/{imageId}/matches/recompute")
    public ResponseEntity<RecomputeMatchesResponse> recompute(@PathVariable Long imageId) {
        MatchOutcome outcome = catalogMatcher.matchImage(imageId);
        return ResponseEntity.ok(RecomputeMatchesResponse.from(imageId, outcome));
    }

    @PostMapping("/images/{imageId}/matches")
    public ResponseEntity<ManualMatchResponse> addManualMatch(
            @PathVariable Long imageId,
            @Valid @RequestBody AddManualMatchRequest request) {

        CatalogMatch match = addManualMatchHandler.handle(imageId, request.catalog(), request.designation());
        return ResponseEntity.status(HttpStatus.CREATED).body(ManualMatchResponse.from(match));
    }

    @PostMapping("/matches/bulk")
    public ResponseEntity<BulkProgress> startBulk(@Valid @RequestBody BulkMatchRequest request) {
        return ResponseEntity.accepted().body(bulkMatchHandler.start(request.pathPrefix()));
    }
}
