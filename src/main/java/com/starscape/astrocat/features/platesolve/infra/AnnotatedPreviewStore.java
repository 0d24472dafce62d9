package com.starscape.astrocat.features.platesolve.infra;

import com.starscape.astrocat.common.config.AstrometryProperties;
import com.starscape.astrocat.common.config.AwsProperties;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;
import software.amazon.awssdk.services.s3.presigner.model.PresignedGetObjectRequest;

import java.time.Duration;

/**
 * S3 storage for annotated previews, one object per image under the configured prefix.
 */
@Component
public class AnnotatedPreviewStore {

    private final S3Client s3Client;
    private final S3Presigner s3Presigner;
    private final String bucket;
    private final Duration presignDuration;
    private final String prefix;

    public AnnotatedPreviewStore(
            S3Client s3Client,
            S3Presigner s3Presigner,
            AwsProperties awsProperties,
            AstrometryProperties properties) {
        this.s3Client = s3Client;
        this.s3Presigner = s3Presigner;
        this.bucket = awsProperties.getS3().getBucket();
        this.presignDuration = awsProperties.getS3().getPresignDuration();
        this.prefix = properties.getAnnotatedPrefix();
    }

    public String keyFor(Long imageId) {
        return prefix + "/" + imageId + ".jpg";
    }

    /**
     * @return the object key
     */
    public String put(Long imageId, byte[] jpeg) {
        String key = keyFor(imageId);
        PutObjectRequest putRequest = PutObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .contentType("image/jpeg")
                .contentLength((long) jpeg.length)
                .build();

        s3Client.putObject(putRequest, RequestBody.fromBytes(jpeg));
        return key;
    }

    public String presignedUrl(String key) {
        GetObjectRequest getRequest = GetObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .build();

        GetObjectPresignRequest presignRequest = GetObjectPresignRequest.builder()
                .signatureDuration(presignDuration)
                .getObjectRequest(getRequest)
                .build();

        PresignedGetObjectRequest presigned = s3Presigner.presignGetObject(presignRequest);
        return presigned.url().toString();
    }
}
