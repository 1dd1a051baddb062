package io.hireflow.forms.clients.mail;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.mail.javamail.JavaMailSender;

@Slf4j
@Configuration
public class MailConfig {

    /**
     * Selects the mailer from {@code forms.mail.enabled}; SMTP needs {@code spring.mail.host}.
     */
    @Bean
    public InvitationMailer invitationMailer(final InvitationMailProperties props,
                                             final ObjectProvider<JavaMailSender> mailSender) {
        if (!props.isEnabled()) {
            log.warn("forms.mail.enabled=false; invitations will be marked failed instead of sent");
            return new LoggingInvitationMailer();
        }
        final JavaMailSender sender = mailSender.getIfAvailable();
        if (sender == null) {
            throw new IllegalStateException("forms.mail.enabled=true but no JavaMailSender is configured (spring.mail.host)");
        }
        return new SmtpInvitationMailer(sender, props);
    }
}
