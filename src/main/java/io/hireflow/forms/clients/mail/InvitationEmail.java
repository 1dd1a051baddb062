package io.hireflow.forms.clients.mail;

import java.time.OffsetDateTime;

public record InvitationEmail(String to,
                              String candidateName,
                              String formName,
                              String link,
                              String customMessage,
                              OffsetDateTime expiresAt,
                              boolean reminder) {
}
