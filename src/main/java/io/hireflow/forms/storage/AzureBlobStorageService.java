package io.hireflow.forms.storage;

import static java.util.Objects.requireNonNull;

import java.io.InputStream;
import java.util.Map;

import com.azure.storage.blob.BlobClient;
import com.azure.storage.blob.BlobContainerClient;
import com.azure.storage.blob.BlobContainerClientBuilder;
import com.azure.storage.blob.models.BlobHttpHeaders;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@ConditionalOnProperty(prefix = "forms.storage.azure", name = "connection-string")
public class AzureBlobStorageService implements StorageService {

    private static final String DEFAULT_CONTENT_TYPE = "application/octet-stream";
    private static final String DEFAULT_CONTAINER = "form-uploads";

    private final BlobContainerClient blobContainerClient;

    public AzureBlobStorageService(final StorageProperties storageProperties) {
        final String container = storageProperties.container() == null || storageProperties.container().isBlank()
                ? DEFAULT_CONTAINER : storageProperties.container();
        this.blobContainerClient = new BlobContainerClientBuilder()
                .connectionString(requireNonNull(storageProperties.connectionString(), "storage connectionString is required"))
                .containerName(container)
                .buildClient();
        this.blobContainerClient.createIfNotExists();
    }

    /* default */ AzureBlobStorageService(final BlobContainerClient blobContainerClient) {
        this.blobContainerClient = requireNonNull(blobContainerClient);
    }

    @Override
    public String store(final String blobPath,
                        final InputStream data,
                        final long size,
                        final String contentType,
                        final Map<String, String> metadata) {
        final BlobClient blob = blobContainerClient.getBlobClient(blobPath);
        blob.upload(data, size, true);
        final String contentTypeToApply =
                (contentType == null || contentType.isBlank()) ? DEFAULT_CONTENT_TYPE : contentType;
        blob.setHttpHeaders(new BlobHttpHeaders().setContentType(contentTypeToApply));
        if (metadata != null && !metadata.isEmpty()) {
            blob.setMetadata(metadata);
        }
        log.debug("Stored blob path={} size={}", blobPath, Long.valueOf(size));
        return blob.getBlobUrl();
    }
}
