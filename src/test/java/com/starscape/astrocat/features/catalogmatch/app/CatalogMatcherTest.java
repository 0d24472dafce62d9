package com.starscape.astrocat.features.catalogmatch.app;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.starscape.astrocat.common.config.MatchingProperties;
import com.starscape.astrocat.common.exception.NotFoundException;
import com.starscape.astrocat.common.wcs.AngularDistance;
import com.starscape.astrocat.common.wcs.WcsModelFactory;
import com.starscape.astrocat.features.catalog.domain.CatalogCandidate;
import com.starscape.astrocat.features.catalog.domain.CatalogEntry;
import com.starscape.astrocat.features.catalog.domain.CatalogStore;
import com.starscape.astrocat.features.catalog.domain.CatalogVariant;
import com.starscape.astrocat.features.catalogmatch.domain.CatalogMatch;
import com.starscape.astrocat.features.catalogmatch.domain.MatchSource;
import com.starscape.astrocat.features.images.domain.Image;
import com.starscape.astrocat.features.images.domain.ImageFixtures;
import com.starscape.astrocat.features.images.domain.ImageRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CatalogMatcherTest {

    @Mock
    private ImageRepository imageRepository;

    @Mock
    private CatalogStore catalogStore;

    @Mock
    private CatalogMatchWriter matchWriter;

    @Captor
    private ArgumentCaptor<Collection<CatalogMatch>> matchesCaptor;

    private CatalogMatcher matcher;

    @BeforeEach
    void setUp() {
        matcher = new CatalogMatcher(imageRepository, catalogStore, matchWriter,
                new WcsModelFactory(new ObjectMapper()), new MatchingProperties());
        lenient().when(matchWriter.replaceAutomaticMatches(eq(1L), anyCollection()))
                .thenAnswer(invocation -> ((Collection<?>) invocation.getArgument(1)).size());
        lenient().when(catalogStore.findWithinRadius(any(), anyDouble(), anyDouble(), anyDouble()))
                .thenReturn(List.of());
    }

    private void stubCandidates(CatalogVariant variant, CatalogCandidate... candidates) {
        when(catalogStore.findWithinRadius(eq(variant), anyDouble(), anyDouble(), anyDouble()))
                .thenReturn(List.of(candidates));
    }

    private void stubEntry(CatalogVariant variant, String designation, double ra, double dec) {
        lenient().when(catalogStore.findEntry(variant, designation))
                .thenReturn(Optional.of(new CatalogEntry(variant, designation, null, "Galaxy", ra, dec, null)));
    }

    private List<CatalogMatch> written() {
        verify(matchWriter).replaceAutomaticMatches(eq(1L), matchesCaptor.capture());
        return new ArrayList<>(matchesCaptor.getValue());
    }

    @Test
    void keepsOnlyCandidatesInsideTheImageFootprint() {
        when(imageRepository.findById(1L)).thenReturn(Optional.of(ImageFixtures.solved(1L, "/data/m31/a.fits")));
        stubCandidates(CatalogVariant.MESSIER, new CatalogCandidate(CatalogVariant.MESSIER, "M31", 0.0));
        stubCandidates(CatalogVariant.NGC,
                new CatalogCandidate(CatalogVariant.NGC, "NGC 224", 0.0),
                new CatalogCandidate(CatalogVariant.NGC, "NGC 205", 0.45));
        stubEntry(CatalogVariant.MESSIER, "M31", 10.0, 41.0);
        stubEntry(CatalogVariant.NGC, "NGC 224", 10.0, 41.0);
        // 0.45 degrees north is 900 pixels above the centre, beyond the 100 pixel margin
        stubEntry(CatalogVariant.NGC, "NGC 205", 10.0, 41.45);

        MatchOutcome outcome = matcher.matchImage(1L);

        assertThat(written()).extracting(CatalogMatch::getDesignation).containsExactly("M31", "NGC 224");
        assertThat(outcome.inserted()).isEqualTo(2);
        assertThat(outcome.pixelValidated()).isTrue();
        assertThat(outcome.catalogsFailed()).isEmpty();
        assertThat(outcome.catalogsQueried()).containsExactly(
                CatalogVariant.MESSIER, CatalogVariant.NGC, CatalogVariant.NAMED_STAR);
    }

    @Test
    void candidateJustOutsideTheRasterIsKeptWithinTheMargin() {
        when(imageRepository.findById(1L)).thenReturn(Optional.of(ImageFixtures.solved(1L, "/data/m31/a.fits")));
        stubCandidates(CatalogVariant.NAMED_STAR,
                new CatalogCandidate(CatalogVariant.NAMED_STAR, "NEAR EDGE", 0.22));
        // 440 pixels north of centre: 40 pixels above the top row
        stubEntry(CatalogVariant.NAMED_STAR, "NEAR EDGE", 10.0, 41.22);

        matcher.matchImage(1L);

        assertThat(written()).extracting(CatalogMatch::getDesignation).containsExactly("NEAR EDGE");
    }

    // 0.2 degrees due east of (10, 41)
    private static final double EAST_RA = 10.0 + 0.2 / Math.cos(Math.toRadians(41.0));

    private Image wideStrip(double rotation, int parity) {
        // 1000 x 400 at 1.8 arcsec: 0.5 x 0.2 degrees
        return ImageFixtures.solved(1L, "/data/m31/strip.fits", 1000, 400, 0.5, 1.8, rotation, parity);
    }

    @Test
    void candidateAlongTheLongAxisIsKeptWhenUnrotated() {
        when(imageRepository.findById(1L)).thenReturn(Optional.of(wideStrip(0.0, 1)));
        stubCandidates(CatalogVariant.NAMED_STAR, new CatalogCandidate(CatalogVariant.NAMED_STAR, "EAST STAR", 0.2));
        stubEntry(CatalogVariant.NAMED_STAR, "EAST STAR", EAST_RA, 41.0);

        matcher.matchImage(1L);

        assertThat(written()).extracting(CatalogMatch::getDesignation).containsExactly("EAST STAR");
    }

    @Test
    void candidateInsideTheRadiusButOffTheRotatedFrameIsRejected() {
        when(imageRepository.findById(1L)).thenReturn(Optional.of(wideStrip(90.0, 1)));
        stubCandidates(CatalogVariant.NAMED_STAR, new CatalogCandidate(CatalogVariant.NAMED_STAR, "EAST STAR", 0.2));
        stubEntry(CatalogVariant.NAMED_STAR, "EAST STAR", EAST_RA, 41.0);

        MatchOutcome outcome = matcher.matchImage(1L);

        // east now runs along the 400 pixel axis: 400 pixels from the centre row, 200 past the edge
        assertThat(written()).isEmpty();
        assertThat(outcome.pixelValidated()).isTrue();
    }

    @Test
    void candidateOffAParityFlippedRotatedFrameIsRejected() {
        when(imageRepository.findById(1L)).thenReturn(Optional.of(wideStrip(90.0, -1)));
        stubCandidates(CatalogVariant.NAMED_STAR, new CatalogCandidate(CatalogVariant.NAMED_STAR, "EAST STAR", 0.2));
        stubEntry(CatalogVariant.NAMED_STAR, "EAST STAR", EAST_RA, 41.0);

        matcher.matchImage(1L);

        assertThat(written()).isEmpty();
    }

    @Test
    void rotatedFrameWithoutAWcsModelFallsBackToTheRadius() {
        Image image = wideStrip(90.0, 1);
        ReflectionTestUtils.setField(image, "pixelScaleArcsec", null);
        when(imageRepository.findById(1L)).thenReturn(Optional.of(image));
        stubCandidates(CatalogVariant.NAMED_STAR, new CatalogCandidate(CatalogVariant.NAMED_STAR, "EAST STAR", 0.2));

        MatchOutcome outcome = matcher.matchImage(1L);

        assertThat(written()).extracting(CatalogMatch::getDesignation).containsExactly("EAST STAR");
        assertThat(outcome.pixelValidated()).isFalse();
    }

    @Test
    void objectAtTheCentreMatchesExactlyAndADistantOneDoesNot() {
        Image image = ImageFixtures.solved(1L, "/data/m31/square.fits", 1000, 1000, 1.0, 2.0, 0.0, 1);
        when(imageRepository.findById(1L)).thenReturn(Optional.of(image));
        Map<String, double[]> messier = new LinkedHashMap<>();
        messier.put("M31", new double[] { 10.0, 41.0 });
        messier.put("FAR", new double[] { 10.0, 43.5 });
        when(catalogStore.findWithinRadius(eq(CatalogVariant.MESSIER), anyDouble(), anyDouble(), anyDouble()))
                .thenAnswer(invocation -> {
                    double ra = invocation.getArgument(1);
                    double dec = invocation.getArgument(2);
                    double radius = invocation.getArgument(3);
                    List<CatalogCandidate> hits = new ArrayList<>();
                    messier.forEach((designation, position) -> {
                        double separation = AngularDistance.separationDegrees(ra, dec, position[0], position[1]);
                        if (separation <= radius) {
                            hits.add(new CatalogCandidate(CatalogVariant.MESSIER, designation, separation));
                        }
                    });
                    return hits;
                });
        stubEntry(CatalogVariant.MESSIER, "M31", 10.0, 41.0);
        stubEntry(CatalogVariant.MESSIER, "FAR", 10.0, 43.5);

        MatchOutcome outcome = matcher.matchImage(1L);

        List<CatalogMatch> matches = written();
        assertThat(matches).extracting(CatalogMatch::getDesignation).containsExactly("M31");
        assertThat(matches.get(0).getAngularSeparationDegrees()).isCloseTo(0.0, within(1e-9));
        assertThat(matches.get(0).getConfidenceScore()).isCloseTo(1.0, within(1e-9));
        assertThat(outcome.inserted()).isEqualTo(1);
        verify(catalogStore).findWithinRadius(CatalogVariant.MESSIER, 10.0, 41.0, 1.0);
    }

    @Test
    void automaticMatchesCarrySeparationAndConfidence() {
        when(imageRepository.findById(1L)).thenReturn(Optional.of(ImageFixtures.solved(1L, "/data/m31/a.fits")));
        stubCandidates(CatalogVariant.MESSIER, new CatalogCandidate(CatalogVariant.MESSIER, "M32", 0.1));
        stubEntry(CatalogVariant.MESSIER, "M32", 10.0, 41.1);

        matcher.matchImage(1L);

        CatalogMatch match = written().get(0);
        assertThat(match.getSource()).isEqualTo(MatchSource.AUTOMATIC);
        assertThat(match.getAngularSeparationDegrees()).isEqualTo(0.1);
        assertThat(match.getConfidenceScore()).isCloseTo(0.98, within(1e-9));
        assertThat(match.isInField()).isTrue();
    }

    @Test
    void failedCatalogIsReportedAndOthersStillMatch() {
        when(imageRepository.findById(1L)).thenReturn(Optional.of(ImageFixtures.solved(1L, "/data/m31/a.fits")));
        stubCandidates(CatalogVariant.MESSIER, new CatalogCandidate(CatalogVariant.MESSIER, "M31", 0.0));
        when(catalogStore.findWithinRadius(eq(CatalogVariant.NGC), anyDouble(), anyDouble(), anyDouble()))
                .thenThrow(new DataAccessResourceFailureException("connection reset"));
        stubEntry(CatalogVariant.MESSIER, "M31", 10.0, 41.0);

        MatchOutcome outcome = matcher.matchImage(1L);

        assertThat(written()).extracting(CatalogMatch::getDesignation).containsExactly("M31");
        assertThat(outcome.catalogsFailed()).containsExactly(CatalogVariant.NGC);
        assertThat(outcome.allCatalogsQueried()).isFalse();
    }

    @Test
    void unresolvableCandidateIsExcludedOnItsOwn() {
        when(imageRepository.findById(1L)).thenReturn(Optional.of(ImageFixtures.solved(1L, "/data/m31/a.fits")));
        stubCandidates(CatalogVariant.NGC,
                new CatalogCandidate(CatalogVariant.NGC, "NGC 224", 0.0),
                new CatalogCandidate(CatalogVariant.NGC, "NGC 9999", 0.1));
        stubEntry(CatalogVariant.NGC, "NGC 224", 10.0, 41.0);
        when(catalogStore.findEntry(CatalogVariant.NGC, "NGC 9999")).thenReturn(Optional.empty());

        matcher.matchImage(1L);

        assertThat(written()).extracting(CatalogMatch::getDesignation).containsExactly("NGC 224");
    }

    @Test
    void duplicateCandidatesAreWrittenOnce() {
        when(imageRepository.findById(1L)).thenReturn(Optional.of(ImageFixtures.solved(1L, "/data/m31/a.fits")));
        stubCandidates(CatalogVariant.NGC,
                new CatalogCandidate(CatalogVariant.NGC, "NGC 224", 0.0),
                new CatalogCandidate(CatalogVariant.NGC, "NGC 224", 0.0));
        stubEntry(CatalogVariant.NGC, "NGC 224", 10.0, 41.0);

        matcher.matchImage(1L);

        assertThat(written()).hasSize(1);
    }

    @Test
    void withoutAWcsModelCandidatesAreAcceptedOnRadius() {
        Image image = ImageFixtures.solved(1L, "/data/m31/a.fits");
        ReflectionTestUtils.setField(image, "pixelScaleArcsec", null);
        when(imageRepository.findById(1L)).thenReturn(Optional.of(image));
        stubCandidates(CatalogVariant.NGC, new CatalogCandidate(CatalogVariant.NGC, "NGC 205", 0.45));

        MatchOutcome outcome = matcher.matchImage(1L);

        assertThat(written()).extracting(CatalogMatch::getDesignation).containsExactly("NGC 205");
        assertThat(outcome.pixelValidated()).isFalse();
        verify(catalogStore, never()).findEntry(any(), any());
    }

    @Test
    void headerSolvedImageWithRadiusIsMatched() {
        Image image = ImageFixtures.headerSolved(1L, "/data/m31/a.fits", 0.5, 1.8, 0.0);
        when(imageRepository.findById(1L)).thenReturn(Optional.of(image));

        MatchOutcome outcome = matcher.matchImage(1L);

        assertThat(outcome.skipped()).isFalse();
        verify(catalogStore).findWithinRadius(CatalogVariant.MESSIER, 10.0, 41.0, 0.5);
    }

    @Test
    void defaultRadiusIsUsedWhenSolvedWithoutOne() {
        Image image = ImageFixtures.solved(1L, "/data/m31/a.fits");
        ReflectionTestUtils.setField(image, "fieldRadiusDegrees", null);
        when(imageRepository.findById(1L)).thenReturn(Optional.of(image));

        matcher.matchImage(1L);

        verify(catalogStore).findWithinRadius(CatalogVariant.NGC, 10.0, 41.0, 1.0);
    }

    @Test
    void imageWithoutCentreIsSkipped() {
        when(imageRepository.findById(1L)).thenReturn(Optional.of(ImageFixtures.unsolved(1L, "/data/a.fits")));

        MatchOutcome outcome = matcher.matchImage(1L);

        assertThat(outcome.skipped()).isTrue();
        verifyNoInteractions(matchWriter);
    }

    @Test
    void unsolvedImageWithoutRadiusIsSkipped() {
        Image image = ImageFixtures.headerSolved(1L, "/data/a.fits", null, null, null);
        when(imageRepository.findById(1L)).thenReturn(Optional.of(image));

        assertThat(matcher.matchImage(1L).skipped()).isTrue();
        verifyNoInteractions(matchWriter);
    }

    @Test
    void missingImageIsNotFound() {
        when(imageRepository.findById(9L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> matcher.matchImage(9L)).isInstanceOf(NotFoundException.class);
    }
}
