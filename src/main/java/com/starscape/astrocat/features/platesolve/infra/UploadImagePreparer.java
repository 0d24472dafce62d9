package com.starscape.astrocat.features.platesolve.infra;

import com.starscape.astrocat.common.config.AstrometryProperties;
import com.starscape.astrocat.features.platesolve.domain.PlateSolverException;
import com.starscape.astrocat.features.platesolve.domain.PreparedUpload;
import net.coobird.thumbnailator.Thumbnails;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;

/**
 * Turns an image file into an upload the solver accepts. Rasters readable by ImageIO are
 * re-encoded as JPEG, down-scaled so the long side fits the configured maximum. FITS and
 * anything else is sent unchanged; the solver reads FITS natively.
 */
@Component
public class UploadImagePreparer {

    private static final Logger log = LoggerFactory.getLogger(UploadImagePreparer.class);
    private static final Set<String> FITS_EXTENSIONS = Set.of("fits", "fit", "fts");
    private static final double JPEG_QUALITY = 0.85;

    private final int maxDimension;

    public UploadImagePreparer(AstrometryProperties properties) {
        this.maxDimension = properties.getUploadMaxDimension();
    }

    public PreparedUpload prepare(String filePath) {
        Path path = Path.of(filePath);
        if (!Files.isRegularFile(path)) {
            throw new PlateSolverException("File not found: " + filePath, false);
        }
        String fileName = path.getFileName().toString();

        try {
            if (FITS_EXTENSIONS.contains(extension(fileName))) {
                return new PreparedUpload(fileName, "application/fits", Files.readAllBytes(path));
            }

            BufferedImage image = ImageIO.read(path.toFile());
            if (image == null) {
                log.debug("No ImageIO reader for {}; uploading original bytes", fileName);
                return new PreparedUpload(fileName, "application/octet-stream", Files.readAllBytes(path));
            }

            ByteArrayOutputStream output = new ByteArrayOutputStream();
            Thumbnails.Builder<BufferedImage> builder = Thumbnails.of(image);
            if (Math.max(image.getWidth(), image.getHeight()) > maxDimension) {
                builder.size(maxDimension, maxDimension);
                log.info("Resizing {} ({}x{}) to fit {}px for upload",
                        fileName, image.getWidth(), image.getHeight(), maxDimension);
            } else {
                builder.scale(1.0);
            }
            builder.imageType(BufferedImage.TYPE_INT_RGB)
                    .outputFormat("jpg")
                    .outputQuality(JPEG_QUALITY)
                    .toOutputStream(output);

            return new PreparedUpload(baseName(fileName) + ".jpg", "image/jpeg", output.toByteArray());
        } catch (IOException e) {
            throw new PlateSolverException("Failed to prepare " + filePath + " for upload: " + e.getMessage(), false, e);
        }
    }

    private static String extension(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot >= 0 ? fileName.substring(dot + 1).toLowerCase(Locale.ROOT) : "";
    }

    private static String baseName(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
