package com.starscape.astrocat.features.platesolve.app;

import com.starscape.astrocat.common.exception.NotFoundException;
import com.starscape.astrocat.features.images.domain.Image;
import com.starscape.astrocat.features.images.domain.ImageFixtures;
import com.starscape.astrocat.features.images.domain.ImageRepository;
import com.starscape.astrocat.features.images.domain.SolveProvider;
import com.starscape.astrocat.features.platesolve.domain.PlateSolverClient;
import com.starscape.astrocat.features.platesolve.domain.PlateSolverException;
import com.starscape.astrocat.features.platesolve.infra.AnnotatedPreviewStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AnnotatedPreviewServiceTest {

    @Mock
    private ImageRepository imageRepository;

    @Mock
    private SolveStateTransitions transitions;

    @Mock
    private PlateSolverClients clients;

    @Mock
    private AnnotatedPreviewStore previewStore;

    @Mock
    private PlateSolverClient client;

    private AnnotatedPreviewService service;

    @BeforeEach
    void setUp() {
        service = new AnnotatedPreviewService(imageRepository, transitions, clients, previewStore);
    }

    @Test
    void storesThePreviewAndLinksItToTheImage() {
        byte[] jpeg = {1, 2, 3};
        when(client.downloadAnnotatedPreview("77")).thenReturn(jpeg);
        when(previewStore.put(4L, jpeg)).thenReturn("annotated/4.jpg");

        service.fetchAndStoreQuietly(4L, "77", client);

        verify(transitions).attachAnnotatedPreview(4L, "annotated/4.jpg");
    }

    @Test
    void downloadFailureAfterSolveIsOnlyLogged() {
        when(client.downloadAnnotatedPreview("77"))
                .thenThrow(new PlateSolverException("Human check bypass failed for job 77", false));

        assertThatCode(() -> service.fetchAndStoreQuietly(4L, "77", client)).doesNotThrowAnyException();
        verify(previewStore, never()).put(anyLong(), any());
        verify(transitions, never()).attachAnnotatedPreview(anyLong(), any());
    }

    @Test
    void refetchUsesTheProviderOfTheOriginalSubmission() {
        Image image = ImageFixtures.solved(4L, "/data/m31.fits");
        image.markSolveProcessing("77");
        byte[] jpeg = {4, 5};
        when(imageRepository.findById(4L)).thenReturn(Optional.of(image));
        when(clients.forProvider(SolveProvider.NOVA)).thenReturn(client);
        when(client.downloadAnnotatedPreview("77")).thenReturn(jpeg);
        when(previewStore.put(4L, jpeg)).thenReturn("annotated/4.jpg");

        assertThat(service.refetch(4L)).isEqualTo("annotated/4.jpg");
    }

    @Test
    void refetchWithoutJobIsRejected() {
        when(imageRepository.findById(4L)).thenReturn(Optional.of(ImageFixtures.unsolved(4L, "/data/m31.fits")));

        assertThatThrownBy(() -> service.refetch(4L)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void presignedUrlRequiresAStoredPreview() {
        Image image = ImageFixtures.solved(4L, "/data/m31.fits");
        when(imageRepository.findById(4L)).thenReturn(Optional.of(image));

        assertThatThrownBy(() -> service.presignedUrl(4L)).isInstanceOf(NotFoundException.class);

        image.attachAnnotatedPreview("annotated/4.jpg");
        when(previewStore.presignedUrl("annotated/4.jpg")).thenReturn("https://s3.example/annotated/4.jpg?sig");
        assertThat(service.presignedUrl(4L)).startsWith("https://s3.example/annotated/4.jpg");
    }
}
