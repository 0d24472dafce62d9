package com.starscape.astrocat.features.platesolve.app;

import com.starscape.astrocat.common.exception.NotFoundException;
import com.starscape.astrocat.features.images.domain.Image;
import com.starscape.astrocat.features.images.domain.ImageRepository;
import com.starscape.astrocat.features.platesolve.domain.PlateSolverClient;
import com.starscape.astrocat.features.platesolve.domain.PlateSolverException;
import com.starscape.astrocat.features.platesolve.infra.AnnotatedPreviewStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Annotated previews rendered by the solver, kept in S3.
 */
@Service
public class AnnotatedPreviewService {

    private static final Logger log = LoggerFactory.getLogger(AnnotatedPreviewService.class);

    private final ImageRepository imageRepository;
    private final SolveStateTransitions transitions;
    private final PlateSolverClients clients;
    private final AnnotatedPreviewStore previewStore;

    public AnnotatedPreviewService(
            ImageRepository imageRepository,
            SolveStateTransitions transitions,
            PlateSolverClients clients,
            AnnotatedPreviewStore previewStore) {
        this.imageRepository = imageRepository;
        this.transitions = transitions;
        this.clients = clients;
        this.previewStore = previewStore;
    }

    /**
     * Post-solve fetch. Failures are logged and swallowed so they never affect the solve.
     */
    public void fetchAndStoreQuietly(Long imageId, String jobId, PlateSolverClient client) {
        try {
            fetchAndStore(imageId, jobId, client);
        } catch (RuntimeException e) {
            log.error("Failed to download annotated preview for image {} (job {}): {}",
                    imageId, jobId, e.getMessage());
        }
    }

    /**
     * Fetch the preview again for an image that already has a solver job.
     *
     * @throws PlateSolverException if the solver does not return an image
     */
    public String refetch(Long imageId) {
        Image image = imageRepository.findById(imageId)
                .orElseThrow(() -> new NotFoundException("Image not found: " + imageId));
        if (image.getJobId() == null) {
            throw new IllegalArgumentException("Image " + imageId + " has no solver job");
        }
        return fetchAndStore(imageId, image.getJobId(), clients.forProvider(image.getSolveProvider()));
    }

    public String presignedUrl(Long imageId) {
        Image image = imageRepository.findById(imageId)
                .orElseThrow(() -> new NotFoundException("Image not found: " + imageId));
        if (image.getAnnotatedS3Key() == null) {
            throw new NotFoundException("No annotated preview for image " + imageId);
        }
        return previewStore.presignedUrl(image.getAnnotatedS3Key());
    }

    private String fetchAndStore(Long imageId, String jobId, PlateSolverClient client) {
        log.info("Downloading annotated preview for image {} (job {})", imageId, jobId);
        byte[] preview = client.downloadAnnotatedPreview(jobId);
        String key = previewStore.put(imageId, preview);
        transitions.attachAnnotatedPreview(imageId, key);
        log.info("Annotated preview stored: imageId={}, key={}, bytes={}", imageId, key, preview.length);
        return key;
    }
}
