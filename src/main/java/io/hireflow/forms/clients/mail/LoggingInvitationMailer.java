package io.hireflow.forms.clients.mail;

import lombok.extern.slf4j.Slf4j;

/**
 * Stand-in used when mail is switched off. It never claims delivery, so invitations end up
 * {@code failed} rather than falsely {@code sent}.
 */
@Slf4j
public class LoggingInvitationMailer implements InvitationMailer {

    static final String DISABLED_MESSAGE = "Email delivery is disabled";

    @Override
    public DeliveryResult send(final InvitationEmail email) {
        log.warn("Mail disabled; not sending form '{}' to {}", email.formName(), email.to());
        return DeliveryResult.failed(DISABLED_MESSAGE);
    }
}
