package im.conversations.iq.xmpp.model.error;

import com.google.common.base.CaseFormat;
import com.google.common.base.Strings;

/** Defined stanza error conditions of RFC 6120, section 8.3.3. */
public enum Condition {
    BAD_REQUEST,
    CONFLICT,
    FEATURE_NOT_IMPLEMENTED,
    FORBIDDEN,
    GONE,
    INTERNAL_SERVER_ERROR,
    ITEM_NOT_FOUND,
    JID_MALFORMED,
    NOT_ACCEPTABLE,
    NOT_ALLOWED,
    NOT_AUTHORIZED,
    POLICY_VIOLATION,
    RECIPIENT_UNAVAILABLE,
    REDIRECT,
    REGISTRATION_REQUIRED,
    REMOTE_SERVER_NOT_FOUND,
    REMOTE_SERVER_TIMEOUT,
    RESOURCE_CONSTRAINT,
    SERVICE_UNAVAILABLE,
    SUBSCRIPTION_REQUIRED,
    UNDEFINED_CONDITION,
    UNEXPECTED_REQUEST;

    /**
     * @return the element name of this condition, e.g. {@code item-not-found}
     */
    public String getName() {
        return CaseFormat.UPPER_UNDERSCORE.to(CaseFormat.LOWER_HYPHEN, name());
    }

    public static Condition valueOfOrNull(final String name) {
        if (Strings.isNullOrEmpty(name)) {
            return null;
        }
        try {
            return valueOf(CaseFormat.LOWER_HYPHEN.to(CaseFormat.UPPER_UNDERSCORE, name));
        } catch (final IllegalArgumentException e) {
            return null;
        }
    }
}
