package io.hireflow.forms.clients.mail;

/**
 * Outbound transport for invitation links. Implementations report failure through the result
 * instead of throwing.
 */
public interface InvitationMailer {

    DeliveryResult send(InvitationEmail email);
}
