package im.conversations.iq.xmpp.model.iot;

import com.google.common.collect.Iterables;
import im.conversations.iq.xml.Namespace;
import im.conversations.iq.xml.Tag;
import im.conversations.iq.xml.XmlReader;
import im.conversations.iq.xml.XmlWriter;
import im.conversations.iq.xmpp.model.Extension;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/** Request to change control parameters of a device (XEP-0325). */
public class ControlSet extends Extension {

    public static final String NAME = "set";

    private final List<ControlParameter> parameters = new ArrayList<>();

    public ControlSet() {
        super(NAME, Namespace.IOT_CONTROL);
    }

    public List<ControlParameter> getParameters() {
        return this.parameters;
    }

    public ControlSet addParameter(final ControlParameter parameter) {
        this.parameters.add(parameter);
        return this;
    }

    /**
     * @return the first parameter with the given value type and name, or {@code null}
     */
    public ControlParameter getParameter(final String type, final String name) {
        return Iterables.find(
                parameters, p -> type.equals(p.getType()) && name.equals(p.getName()), null);
    }

    @Override
    protected void decodeChild(final XmlReader reader, final Tag child) throws IOException {
        this.parameters.add(
                new ControlParameter(
                        child.getName(), child.getAttribute("name"), child.getAttribute("value")));
        reader.skip(child);
    }

    @Override
    protected void encodeChildren(final XmlWriter writer) throws IOException {
        for (final ControlParameter parameter : parameters) {
            parameter.encode(writer);
        }
    }
}
