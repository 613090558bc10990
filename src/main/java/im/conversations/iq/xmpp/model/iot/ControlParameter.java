package im.conversations.iq.xmpp.model.iot;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.base.Preconditions;
import im.conversations.iq.xml.Encodable;
import im.conversations.iq.xml.XmlWriter;
import java.io.IOException;

/**
 * One control parameter of a {@link ControlSet}. The element name carries the value type
 * ({@code string}, {@code boolean}, {@code int}, ...).
 */
public class ControlParameter implements Encodable {

    public static final String STRING = "string";
    public static final String BOOLEAN = "boolean";
    public static final String INT = "int";
    public static final String LONG = "long";
    public static final String DOUBLE = "double";

    private final String type;
    private final String name;
    private final String value;

    public ControlParameter(final String type, final String name, final String value) {
        this.type = Preconditions.checkNotNull(type, "parameter type must not be null");
        this.name = name;
        this.value = value;
    }

    public static ControlParameter ofString(final String name, final String value) {
        return new ControlParameter(STRING, name, value);
    }

    public String getType() {
        return type;
    }

    public String getName() {
        return name;
    }

    public String getValue() {
        return value;
    }

    @Override
    public void encode(final XmlWriter writer) throws IOException {
        writer.startElement(null, type)
                .attribute("name", name)
                .attribute("value", value)
                .endElement();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ControlParameter that = (ControlParameter) o;
        return Objects.equal(type, that.type)
                && Objects.equal(name, that.name)
                && Objects.equal(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(type, name, value);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("type", type)
                .add("name", name)
                .add("value", value)
                .toString();
    }
}
