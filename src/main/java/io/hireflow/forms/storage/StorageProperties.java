package io.hireflow.forms.storage;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "forms.storage.azure")
public record StorageProperties(
        String connectionString,
        String container     // OPTIONAL: defaults to "form-uploads"
) {
}
