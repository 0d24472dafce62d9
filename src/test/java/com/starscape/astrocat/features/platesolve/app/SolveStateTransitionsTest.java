package com.starscape.astrocat.features.platesolve.app;

import com.starscape.astrocat.common.exception.NotFoundException;
import com.starscape.astrocat.features.images.domain.AstrometryStatus;
import com.starscape.astrocat.features.images.domain.Image;
import com.starscape.astrocat.features.images.domain.ImageFixtures;
import com.starscape.astrocat.features.images.domain.ImageRepository;
import com.starscape.astrocat.features.images.domain.SolveProvider;
import com.starscape.astrocat.features.platesolve.domain.Calibration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SolveStateTransitionsTest {

    @Mock
    private ImageRepository imageRepository;

    @InjectMocks
    private SolveStateTransitions transitions;

    private Image stored(Image image) {
        when(imageRepository.findByIdForUpdate(image.getId())).thenReturn(Optional.of(image));
        return image;
    }

    @Test
    void claimMovesFreshImageToSubmitted() {
        Image image = stored(ImageFixtures.unsolved(1L, "/data/m31/a.fits"));

        SolveClaim claim = transitions.claim(1L, SolveProvider.LOCAL, false);

        assertThat(claim.claimed()).isTrue();
        assertThat(claim.filePath()).isEqualTo("/data/m31/a.fits");
        assertThat(claim.previousStatus()).isEqualTo(AstrometryStatus.NONE);
        assertThat(claim.hints().isBlind()).isTrue();
        assertThat(image.getAstrometryStatus()).isEqualTo(AstrometryStatus.SUBMITTED);
        assertThat(image.getSolveProvider()).isEqualTo(SolveProvider.LOCAL);
        verify(imageRepository).save(image);
    }

    @Test
    void forcedResolveUsesThePreviousSolutionAsHints() {
        stored(ImageFixtures.solved(1L, "/data/m31/a.fits"));

        SolveClaim claim = transitions.claim(1L, SolveProvider.NOVA, true);

        assertThat(claim.claimed()).isTrue();
        assertThat(claim.hints().centerRaDegrees()).isEqualTo(10.0);
        assertThat(claim.hints().centerDecDegrees()).isEqualTo(41.0);
        assertThat(claim.hints().radiusDegrees()).isEqualTo(0.5);
        assertThat(claim.hints().scaleLowerArcsec()).isCloseTo(1.62, within(1e-9));
        assertThat(claim.hints().scaleUpperArcsec()).isCloseTo(1.98, within(1e-9));
    }

    @Test
    void retryAfterFailureIsBlindEvenWithStoredCoordinates() {
        Image image = ImageFixtures.headerSolved(1L, "/data/m31/a.fits", 0.5, 1.8, 0.0);
        image.claimForSolve(SolveProvider.NOVA);
        image.markSolveFailed("Solver reported failure");
        stored(image);

        SolveClaim claim = transitions.claim(1L, SolveProvider.NOVA, false);

        assertThat(claim.claimed()).isTrue();
        assertThat(claim.previousStatus()).isEqualTo(AstrometryStatus.FAILED);
        assertThat(claim.hints().isBlind()).isTrue();
    }

    @Test
    void solvedImageIsNotResubmittedWithoutForce() {
        stored(ImageFixtures.solved(1L, "/data/m31/a.fits"));

        SolveClaim claim = transitions.claim(1L, SolveProvider.NOVA, false);

        assertThat(claim.claimed()).isFalse();
        verify(imageRepository, never()).save(any());
    }

    @Test
    void inFlightImageIsNotClaimedEvenWhenForced() {
        stored(ImageFixtures.inFlight(1L, "/data/m31/a.fits", "sub-9"));

        SolveClaim claim = transitions.claim(1L, SolveProvider.NOVA, true);

        assertThat(claim.outcome()).isEqualTo(SolveClaim.Outcome.ALREADY_STARTED);
        assertThat(claim.previousStatus()).isEqualTo(AstrometryStatus.SUBMITTED);
    }

    @Test
    void claimOfUnknownImageIsNotFound() {
        when(imageRepository.findByIdForUpdate(9L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> transitions.claim(9L, SolveProvider.NOVA, false))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    void submissionIsRecordedOnlyWhileSubmitted() {
        Image image = stored(ImageFixtures.unsolved(1L, "/data/m31/a.fits"));

        assertThat(transitions.recordSubmission(1L, "sub-1")).isFalse();

        image.claimForSolve(SolveProvider.NOVA);
        assertThat(transitions.recordSubmission(1L, "sub-1")).isTrue();
        assertThat(image.getSubmissionId()).isEqualTo("sub-1");
    }

    @Test
    void beginPollCountsAttemptsForTheCurrentSubmission() {
        stored(ImageFixtures.inFlight(1L, "/data/m31/a.fits", "sub-1"));

        assertThat(transitions.beginPoll(1L, "sub-1")).map(PollTicket::attempt).contains(1);
        assertThat(transitions.beginPoll(1L, "sub-1")).map(PollTicket::attempt).contains(2);
        assertThat(transitions.beginPoll(1L, "sub-old")).isEmpty();
    }

    @Test
    void markProcessingRecordsTheJobOnce() {
        Image image = stored(ImageFixtures.inFlight(1L, "/data/m31/a.fits", "sub-1"));

        transitions.markProcessing(1L, "sub-1", "77");
        transitions.markProcessing(1L, "sub-1", "77");

        assertThat(image.getAstrometryStatus()).isEqualTo(AstrometryStatus.PROCESSING);
        assertThat(image.getJobId()).isEqualTo("77");
        verify(imageRepository).save(image);
    }

    @Test
    void markSolvedStoresTheCalibration() {
        Image image = stored(ImageFixtures.inFlight(1L, "/data/m31/a.fits", "sub-1"));

        boolean solved = transitions.markSolved(1L, "sub-1",
                Calibration.of(370.0, 41.0, 0.5, 1.8, -90.0, -1.0), "{\"CRVAL1\":10.0}", "https://nova.example/status/sub-1");

        assertThat(solved).isTrue();
        assertThat(image.getAstrometryStatus()).isEqualTo(AstrometryStatus.SOLVED);
        assertThat(image.isPlateSolved()).isTrue();
        assertThat(image.getRaCenterDegrees()).isEqualTo(10.0);
        assertThat(image.getRotationDegrees()).isEqualTo(270.0);
        assertThat(image.getParity()).isEqualTo(-1);
        assertThat(image.getWcsHeader()).isEqualTo("{\"CRVAL1\":10.0}");
    }

    @Test
    void staleSubmissionCannotOverwriteState() {
        Image image = stored(ImageFixtures.inFlight(1L, "/data/m31/a.fits", "sub-2"));

        boolean solved = transitions.markSolved(1L, "sub-1",
                Calibration.of(10.0, 41.0, 0.5, 1.8, 0.0, 1.0), null, null);
        boolean failed = transitions.markFailed(1L, "sub-1", "Solver job failed");

        assertThat(solved).isFalse();
        assertThat(failed).isFalse();
        assertThat(image.getAstrometryStatus()).isEqualTo(AstrometryStatus.SUBMITTED);
    }

    @Test
    void failureWithoutSubmissionIdFailsAnyInFlightRun() {
        Image image = stored(ImageFixtures.inFlight(1L, "/data/m31/a.fits", "sub-2"));

        assertThat(transitions.markFailed(1L, null, "Upload failed: timeout")).isTrue();
        assertThat(image.getAstrometryStatus()).isEqualTo(AstrometryStatus.FAILED);
        assertThat(image.getAstrometryError()).isEqualTo("Upload failed: timeout");
    }

    @Test
    void failureDoesNotTouchASolvedImage() {
        Image image = stored(ImageFixtures.solved(1L, "/data/m31/a.fits"));

        assertThat(transitions.markFailed(1L, null, "late failure")).isFalse();
        assertThat(image.getAstrometryStatus()).isEqualTo(AstrometryStatus.SOLVED);
    }
}
