package com.starscape.astrocat.features.catalogmatch.api;

import com.starscape.astrocat.common.exception.NotFoundException;
import com.starscape.astrocat.common.progress.BulkProgress;
import com.starscape.astrocat.features.catalogmatch.api.dto.ImageMatchesResponse;
import com.starscape.astrocat.features.catalogmatch.app.BulkMatchHandler;
import com.starscape.astrocat.features.catalogmatch.app.ListImageMatchesHandler;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/queries")
public class CatalogMatchQueryController {

    private final ListImageMatchesHandler listImageMatchesHandler;
    private final BulkMatchHandler bulkMatchHandler;

    public CatalogMatchQueryController(
            ListImageMatchesHandler listImageMatchesHandler,
            BulkMatchHandler bulkMatchHandler) {
        this.listImageMatchesHandler = listImageMatchesHandler;
        this.bulkMatchHandler = bulkMatchHandler;
    }

    @GetMapping("/images/{imageId}/matches")
    public ResponseEntity<ImageMatchesResponse> listMatches(@PathVariable Long imageId) {
        return ResponseEntity.ok(listImageMatchesHandler.handle(imageId));
    }

    @GetMapping("/matches/bulk")
    public ResponseEntity<BulkProgress> bulkProgress(@RequestParam(defaultValue = "") String pathPrefix) {
        BulkProgress progress = bulkMatchHandler.progress(pathPrefix)
                .orElseThrow(() -> new NotFoundException("No catalog matching run for prefix '" + pathPrefix + "'"));
        return ResponseEntity.ok(progress);
    }
}
