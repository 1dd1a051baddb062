package io.hireflow.forms.config;

import java.time.Duration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@ConfigurationProperties(prefix = "forms")
public class FormsProperties {

    /**
     * Public origin that candidate links are built on: {@code {baseUrl}/form/{token}}.
     */
    @NotBlank
    private String baseUrl = "http://localhost:5173";

    @Valid
    private Invitation invitation = new Invitation();

    @Valid
    private Template template = new Template();

    @Valid
    private Upload upload = new Upload();

    public String invitationLink(final String token) {
        final String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        return base + "/form/" + token;
    }

    @Data
    public static class Invitation {

        /**
         * Lifetime of a freshly issued link.
         */
        @NotNull
        private Duration ttl = Duration.ofDays(14);

        /**
         * Upper bound on application ids accepted by one bulk issue call.
         */
        @Positive
        @Max(1000)
        private int bulkMax = 100;
    }

    @Data
    public static class Template {

        @Positive
        private int maxFields = 50;

        @Positive
        private int maxNameLength = 200;

        @Positive
        private int maxDescriptionLength = 1000;
    }

    @Data
    public static class Upload {

        /**
         * Largest accepted candidate upload in bytes.
         */
        @Positive
        private long maxBytes = 10L * 1024 * 1024;
    }
}
