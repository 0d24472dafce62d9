package com.starscape.astrocat.features.platesolve.api;

import com.starscape.astrocat.common.progress.BulkProgress;
import com.starscape.astrocat.features.platesolve.api.dto.BulkSolveRequest;
import com.starscape.astrocat.features.platesolve.api.dto.SolveSettingsResponse;
import com.starscape.astrocat.features.platesolve.api.dto.UpdateSolveSettingsRequest;
import com.starscape.astrocat.features.platesolve.app.AnnotatedPreviewService;
import com.starscape.astrocat.features.platesolve.app.BulkSolveHandler;
import com.starscape.astrocat.features.platesolve.app.PlateSolveWorkflow;
import com.starscape.astrocat.features.platesolve.app.SolveRequestResult;
import com.starscape.astrocat.features.platesolve.app.SolveSettingsHandler;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/commands")
public class PlateSolveCommandController {

    private final PlateSolveWorkflow workflow;
    private final AnnotatedPreviewService annotatedPreviewService;
    private final BulkSolveHandler bulkSolveHandler;
    private final SolveSettingsHandler settingsHandler;

    public PlateSolveCommandController(
            PlateSolveWorkflow workflow,
            AnnotatedPreviewService annotatedPreviewService,
            BulkSolveHandler bulkSolveHandler,
            SolveSettingsHandler settingsHandler) {
        this.workflow = workflow;
        this.annotatedPreviewService = annotatedPreviewService;
        this.bulkSolveHandler = bulkSolveHandler;
        this.settingsHandler = settingsHandler;
    }

    /**
     * Submit an image to the solver. The upload happens synchronously; monitoring continues
     * in the background. A deferred request is retried automatically.
     * POST /commands/images/{imageId}/solve
     */
    @PostMapping("/images/{imageId}/solve")
    public ResponseEntity<SolveRequestResult> requestSolve(
            @PathVariable Long imageId,
            @RequestParam(defaultValue = "false") boolean force) {

        SolveRequestResult result = workflow.submit(imageId, force, 0);
        HttpStatus status = switch (result.status()) {
            case SUBMITTED, DEFERRED -> HttpStatus.ACCEPTED;
            case ALREADY_STARTED -> HttpStatus.OK;
            case FAILED -> HttpStatus.BAD_GATEWAY;
        };
        return ResponseEntity.status(status).body(result);
    }

    @PostMapping("/images/{imageId}/annotation")
    public ResponseEntity<Map<String, String>> refetchAnnotation(@PathVariable Long imageId) {
        String key = annotatedPreviewService.refetch(imageId);
        return ResponseEntity.ok(Map.of("key", key));
    }

    @PostMapping("/plate-solve/bulk")
    public ResponseEntity<BulkProgress> startBulk(@Valid @RequestBody BulkSolveRequest request) {
        return ResponseEntity.accepted().body(bulkSolveHandler.start(request.pathPrefix(), request.force()));
    }

    @PutMapping("/plate-solve/settings")
    public ResponseEntity<SolveSettingsResponse> updateSettings(@Valid @RequestBody UpdateSolveSettingsRequest request) {
        return ResponseEntity.ok(settingsHandler.update(request.maxInFlight(), request.provider()));
    }
}
