package io.hireflow.forms.domain;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle of a form invitation. The allowed transitions live here and nowhere else.
 *
 * <pre>
 * pending -> sent -> viewed -> answered
 * pending | sent | viewed -> expired
 * pending | sent -> failed
 * sent -> answered (submitted without a recorded view)
 * </pre>
 */
public enum InvitationStatus {
    PENDING,
    SENT,
    VIEWED,
    ANSWERED,
    EXPIRED,
    FAILED;

    private static final Map<InvitationStatus, Set<InvitationStatus>> TRANSITIONS = Map.of(
            PENDING, Collections.unmodifiableSet(EnumSet.of(SENT, FAILED, EXPIRED)),
            SENT, Collections.unmodifiableSet(EnumSet.of(VIEWED, ANSWERED, FAILED, EXPIRED)),
            VIEWED, Collections.unmodifiableSet(EnumSet.of(ANSWERED, EXPIRED)),
            ANSWERED, Collections.unmodifiableSet(EnumSet.noneOf(InvitationStatus.class)),
            EXPIRED, Collections.unmodifiableSet(EnumSet.noneOf(InvitationStatus.class)),
            FAILED, Collections.unmodifiableSet(EnumSet.noneOf(InvitationStatus.class))
    );

    /**
     * Statuses that block a second invitation for the same application and form.
     */
    public static final Set<InvitationStatus> ACTIVE =
            Collections.unmodifiableSet(EnumSet.of(PENDING, SENT, VIEWED));

    public boolean canTransitionTo(final InvitationStatus target) {
        return TRANSITIONS.get(this).contains(target);
    }

    public boolean isActive() {
        return ACTIVE.contains(this);
    }

    public boolean isTerminal() {
        return TRANSITIONS.get(this).isEmpty();
    }

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
