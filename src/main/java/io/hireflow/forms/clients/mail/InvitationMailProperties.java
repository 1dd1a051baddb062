package io.hireflow.forms.clients.mail;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "forms.mail")
public class InvitationMailProperties {

    /**
     * When false, invitations are only logged and every delivery reports failure.
     */
    private boolean enabled;

    /**
     * Sender address for invitation emails.
     */
    private String from = "no-reply@hireflow.io";

    private String subjectPrefix = "Form Request: ";
}
