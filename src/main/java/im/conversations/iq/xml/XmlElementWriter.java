package im.conversations.iq.xml;

import java.io.IOException;
import java.io.StringWriter;

public final class XmlElementWriter {

    public static String write(final Encodable element) {
        final StringWriter stringWriter = new StringWriter();
        try {
            new XmlWriter(stringWriter).writeElement(element);
        } catch (final IOException e) {
            throw new IllegalStateException("unable to write to string", e);
        }
        return stringWriter.toString();
    }

    private XmlElementWriter() {}
}
