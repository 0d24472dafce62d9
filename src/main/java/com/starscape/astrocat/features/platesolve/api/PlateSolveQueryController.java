package com.starscape.astrocat.features.platesolve.api;

import com.starscape.astrocat.common.config.AwsProperties;
import com.starscape.astrocat.common.exception.NotFoundException;
import com.starscape.astrocat.common.progress.BulkProgress;
import com.starscape.astrocat.features.platesolve.api.dto.AnnotatedPreviewResponse;
import com.starscape.astrocat.features.platesolve.api.dto.PlateSolveStatusResponse;
import com.starscape.astrocat.features.platesolve.api.dto.SolveSettingsResponse;
import com.starscape.astrocat.features.platesolve.app.AnnotatedPreviewService;
import com.starscape.astrocat.features.platesolve.app.BulkSolveHandler;
import com.starscape.astrocat.features.platesolve.app.GetPlateSolveStatusHandler;
import com.starscape.astrocat.features.platesolve.app.SolveSettingsHandler;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;

@RestController
@RequestMapping("/queries")
public class PlateSolveQueryController {

    private final GetPlateSolveStatusHandler statusHandler;
    private final SolveSettingsHandler settingsHandler;
    private final AnnotatedPreviewService annotatedPreviewService;
    private final BulkSolveHandler bulkSolveHandler;
    private final Duration presignDuration;

    public PlateSolveQueryController(
            GetPlateSolveStatusHandler statusHandler,
            SolveSettingsHandler settingsHandler,
            AnnotatedPreviewService annotatedPreviewService,
            BulkSolveHandler bulkSolveHandler,
            AwsProperties awsProperties) {
        this.statusHandler = statusHandler;
        this.settingsHandler = settingsHandler;
        this.annotatedPreviewService = annotatedPreviewService;
        this.bulkSolveHandler = bulkSolveHandler;
        this.presignDuration = awsProperties.getS3().getPresignDuration();
    }

    @GetMapping("/images/{imageId}/plate-solve")
    public ResponseEntity<PlateSolveStatusResponse> getStatus(@PathVariable Long imageId) {
        return ResponseEntity.ok(statusHandler.handle(imageId));
    }

    @GetMapping("/images/{imageId}/annotated")
    public ResponseEntity<AnnotatedPreviewResponse> getAnnotated(@PathVariable Long imageId) {
        String url = annotatedPreviewService.presignedUrl(imageId);
        return ResponseEntity.ok(new AnnotatedPreviewResponse(imageId, url, (int) presignDuration.toSeconds()));
    }

    @GetMapping("/plate-solve/settings")
    public ResponseEntity<SolveSettingsResponse> getSettings() {
        return ResponseEntity.ok(settingsHandler.get());
    }

    @GetMapping("/plate-solve/bulk")
    public ResponseEntity<BulkProgress> bulkProgress(@RequestParam(defaultValue = "") String pathPrefix) {
        BulkProgress progress = bulkSolveHandler.progress(pathPrefix)
                .orElseThrow(() -> new NotFoundException("No bulk plate solve for prefix '" + pathPrefix + "'"));
        return ResponseEntity.ok(progress);
    }
}
