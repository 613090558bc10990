package im.conversations.iq.xmpp.model.error;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.base.Strings;
import com.google.common.primitives.Ints;
import im.conversations.iq.xml.Namespace;
import im.conversations.iq.xml.Tag;
import im.conversations.iq.xml.XmlReader;
import im.conversations.iq.xml.XmlWriter;
import im.conversations.iq.xmpp.model.Payload;
import java.io.IOException;
import java.util.Locale;

/**
 * The {@code <error/>} child of an error stanza: a legacy numeric code, an error type, the
 * defined condition (reason) and an optional descriptive text.
 *
 * <p>A code of {@code 0} means there is no error. Such an error is not written at all.
 */
public class Error implements Payload {

    public static final String NAME = "error";
    private static final String TEXT = "text";

    private int code;
    private String type = "";
    private String reason = "";
    private String text = "";

    public Error() {}

    public Error(final int code, final String type, final String reason, final String text) {
        this.code = code;
        this.type = Strings.nullToEmpty(type);
        this.reason = Strings.nullToEmpty(reason);
        this.text = Strings.nullToEmpty(text);
    }

    public static Error of(
            final int code, final Type type, final Condition condition, final String text) {
        final Error error = new Error();
        error.setCode(code);
        error.setType(type);
        error.setCondition(condition);
        error.setText(text);
        return error;
    }

    public int getCode() {
        return code;
    }

    public void setCode(final int code) {
        this.code = code;
    }

    public String getType() {
        return type;
    }

    public void setType(final String type) {
        this.type = Strings.nullToEmpty(type);
    }

    public void setType(final Type type) {
        this.type = type == null ? "" : type.toString().toLowerCase(Locale.ROOT);
    }

    public Type getTypeOrNull() {
        return Type.valueOfOrNull(this.type);
    }

    public String getReason() {
        return reason;
    }

    public void setReason(final String reason) {
        this.reason = Strings.nullToEmpty(reason);
    }

    public Condition getCondition() {
        return Condition.valueOfOrNull(this.reason);
    }

    public void setCondition(final Condition condition) {
        this.reason = condition == null ? "" : condition.getName();
    }

    public String getText() {
        return text;
    }

    public void setText(final String text) {
        this.text = Strings.nullToEmpty(text);
    }

    @Override
    public void decode(final XmlReader reader, final Tag start) throws IOException {
        final Integer code = Ints.tryParse(Strings.nullToEmpty(start.getAttribute("code")));
        this.code = code == null ? 0 : code;
        this.type = Strings.nullToEmpty(start.getAttribute("type"));
        Tag nextTag = reader.readRequiredTag();
        while (!nextTag.isEnd(start.getName())) {
            if (nextTag.isStart(TEXT, Namespace.STANZAS)) {
                this.text = reader.readText(nextTag);
            } else if (nextTag.isStart() && Namespace.STANZAS.equals(nextTag.getNamespace())) {
                // last condition wins
                this.reason = nextTag.getName();
                reader.skip(nextTag);
            } else if (nextTag.isStart()) {
                reader.skip(nextTag);
            }
            nextTag = reader.readRequiredTag();
        }
    }

    @Override
    public void encode(final XmlWriter writer) throws IOException {
        if (code == 0) {
            return;
        }
        writer.startElement(null, NAME);
        writer.attribute("code", Integer.toString(code));
        if (!type.isEmpty()) {
            writer.attribute("type", type);
        }
        if (!reason.isEmpty()) {
            writer.startElement(Namespace.STANZAS, reason).endElement();
        }
        if (!text.isEmpty()) {
            writer.startElement(Namespace.STANZAS, TEXT).text(text).endElement();
        }
        writer.endElement();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Error error = (Error) o;
        return code == error.code
                && Objects.equal(type, error.type)
                && Objects.equal(reason, error.reason)
                && Objects.equal(text, error.text);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(code, type, reason, text);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("code", code)
                .add("type", type)
                .add("reason", reason)
                .add("text", text)
                .toString();
    }

    public enum Type {
        AUTH,
        CANCEL,
        CONTINUE,
        MODIFY,
        WAIT;

        public static Type valueOfOrNull(final String type) {
            if (Strings.isNullOrEmpty(type)) {
                return null;
            }
            try {
                return valueOf(type.toUpperCase(Locale.ROOT));
            } catch (final IllegalArgumentException e) {
                return null;
            }
        }
    }
}
