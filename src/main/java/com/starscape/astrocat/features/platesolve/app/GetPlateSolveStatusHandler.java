package com.starscape.astrocat.features.platesolve.app;

import com.starscape.astrocat.common.exception.NotFoundException;
import com.starscape.astrocat.features.images.domain.Image;
import com.starscape.astrocat.features.images.domain.ImageRepository;
import com.starscape.astrocat.features.platesolve.api.dto.PlateSolveStatusResponse;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class GetPlateSolveStatusHandler {

    private final ImageRepository imageRepository;

    public GetPlateSolveStatusHandler(ImageRepository imageRepository) {
        this.imageRepository = imageRepository;
    }

    @Transactional(readOnly = true)
    public PlateSolveStatusResponse handle(Long imageId) {
        Image image = imageRepository.findById(imageId)
                .orElseThrow(() -> new NotFoundException("Image not found: " + imageId));

        return new PlateSolveStatusResponse(
            image.getId(),
            image.getAstrometryStatus().name(),
            image.isPlateSolved(),
            image.getPlateSolveSource(),
            image.getSolveProvider() != null ? image.getSolveProvider().name() : null,
            image.getSubmissionId(),
            image.getJobId(),
            image.getPollAttempts(),
            image.getAstrometryError(),
            image.getAstrometryUrl(),
            image.getRaCenterDegrees(),
            image.getDecCenterDegrees(),
            image.getFieldRadiusDegrees(),
            image.getPixelScaleArcsec(),
            image.getRotationDegrees(),
            image.getParity(),
            image.getWcsHeader() != null,
            image.getAnnotatedS3Key() != null,
            image.getUpdatedAt()
        );
    }
}
