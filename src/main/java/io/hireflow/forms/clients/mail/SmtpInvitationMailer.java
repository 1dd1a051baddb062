package io.hireflow.forms.clients.mail;

import java.nio.charset.StandardCharsets;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.util.StringUtils;

/**
 * Plain-text invitation email over SMTP.
 */
@Slf4j
public class SmtpInvitationMailer implements InvitationMailer {

    private static final DateTimeFormatter EXPIRY_FORMAT = DateTimeFormatter.ofPattern("d MMM yyyy HH:mm 'UTC'", Locale.ENGLISH)
            .withZone(ZoneOffset.UTC);

    private final JavaMailSender mailSender;
    private final InvitationMailProperties props;

    public SmtpInvitationMailer(final JavaMailSender mailSender, final InvitationMailProperties props) {
        this.mailSender = mailSender;
        this.props = props;
    }

    @Override
    public DeliveryResult send(final InvitationEmail email) {
        if (!StringUtils.hasText(email.to())) {
            return DeliveryResult.failed("Candidate has no email address");
        }
        final String subject = (email.reminder() ? "Reminder: " : "") + props.getSubjectPrefix() + email.formName();
        try {
            final MimeMessage msg = mailSender.createMimeMessage();
            final MimeMessageHelper helper = new MimeMessageHelper(msg, false, StandardCharsets.UTF_8.name());
            helper.setFrom(new InternetAddress(props.getFrom().trim()));
            helper.setTo(email.to().trim());
            helper.setSubject(subject);
            helper.setText(body(email), false);
            mailSender.send(msg);
            log.info("Invitation email sent to={} form='{}' reminder={}", email.to(), email.formName(), email.reminder());
            return DeliveryResult.delivered();
        } catch (Exception e) {
            log.warn("Invitation email failed to={} form='{}': {}", email.to(), email.formName(), e.getMessage(), e);
            return DeliveryResult.failed(e.getMessage());
        }
    }

    static String body(final InvitationEmail email) {
        final StringBuilder text = new StringBuilder();
        text.append("Hi ").append(StringUtils.hasText(email.candidateName()) ? email.candidateName() : "there").append(",\n\n");
        if (email.reminder()) {
            text.append("This is a friendly reminder that we are still waiting for your answers to \"");
        } else {
            text.append("We'd like a little more information from you. Please complete \"");
        }
        text.append(email.formName()).append("\".\n\n");
        if (StringUtils.hasText(email.customMessage())) {
            text.append(email.customMessage().trim()).append("\n\n");
        }
        text.append("Open the form: ").append(email.link()).append('\n');
        if (email.expiresAt() != null) {
            text.append("This link expires on ").append(EXPIRY_FORMAT.format(email.expiresAt())).append(".\n");
        }
        return text.toString();
    }
}
