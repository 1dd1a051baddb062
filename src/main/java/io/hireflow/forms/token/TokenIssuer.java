package io.hireflow.forms.token;

import io.hireflow.forms.domain.FormInvitation;
import io.hireflow.forms.errors.TokenNotFoundException;
import io.hireflow.forms.repo.FormInvitationRepository;

import java.security.SecureRandom;
import java.util.Base64;
import java.util.Optional;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

/**
 * Issues invitation tokens (32 random bytes, base64url without padding) and resolves them.
 */
@Component
public class TokenIssuer {

    public static final int TOKEN_BYTES = 32;
    public static final int TOKEN_LENGTH = 43;

    private static final Pattern TOKEN_SHAPE = Pattern.compile("^[A-Za-z0-9_-]{" + TOKEN_LENGTH + "}$");
    private static final int VISIBLE_PREFIX = 6;

    private final SecureRandom secureRandom = new SecureRandom();
    private final Base64.Encoder encoder = Base64.getUrlEncoder().withoutPadding();
    private final FormInvitationRepository formInvitationRepository;

    public TokenIssuer(final FormInvitationRepository formInvitationRepository) {
        this.formInvitationRepository = formInvitationRepository;
    }

    public String issue() {
        final byte[] bytes = new byte[TOKEN_BYTES];
        secureRandom.nextBytes(bytes);
        return encoder.encodeToString(bytes);
    }

    public boolean isWellFormed(final String token) {
        return token != null && TOKEN_SHAPE.matcher(token).matches();
    }

    public Optional<FormInvitation> find(final String token) {
        if (!isWellFormed(token)) {
            return Optional.empty();
        }
        return formInvitationRepository.findByToken(token);
    }

    /**
     * Row-locking variant for paths that may change the invitation's status.
     */
    public Optional<FormInvitation> findForUpdate(final String token) {
        if (!isWellFormed(token)) {
            return Optional.empty();
        }
        return formInvitationRepository.findByTokenForUpdate(token);
    }

    public FormInvitation validate(final String token) {
        return find(token).orElseThrow(TokenNotFoundException::new);
    }

    /**
     * {@link #validate} holding a {@code PESSIMISTIC_WRITE} lock until the surrounding transaction ends.
     */
    public FormInvitation validateForUpdate(final String token) {
        return findForUpdate(token).orElseThrow(TokenNotFoundException::new);
    }

    /**
     * Log-safe form of a token.
     */
    public static String redact(final String token) {
        if (token == null) {
            return "null";
        }
        return token.length() <= VISIBLE_PREFIX ? "***" : token.substring(0, VISIBLE_PREFIX) + "...";
    }
}
