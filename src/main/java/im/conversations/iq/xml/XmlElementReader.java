package im.conversations.iq.xml;

import com.google.common.io.ByteSource;
import im.conversations.iq.xmpp.ExtensionFactory;
import im.conversations.iq.xmpp.model.Payload;
import im.conversations.iq.xmpp.model.stanza.Iq;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;

public final class XmlElementReader {

    public static Payload read(final String xml) throws IOException {
        return read(xml, ExtensionFactory.DEFAULT);
    }

    public static Payload read(final String xml, final ExtensionFactory extensionFactory)
            throws IOException {
        final XmlReader xmlReader = new XmlReader(extensionFactory);
        xmlReader.setReader(new StringReader(xml));
        return xmlReader.readPayload(xmlReader.readStartTag());
    }

    public static Payload read(final byte[] bytes) throws IOException {
        return read(ByteSource.wrap(bytes).openStream());
    }

    public static Payload read(final InputStream inputStream) throws IOException {
        final XmlReader xmlReader = new XmlReader();
        xmlReader.setInputStream(inputStream);
        return xmlReader.readPayload(xmlReader.readStartTag());
    }

    public static Iq readIq(final String xml) throws IOException {
        return readIq(xml, ExtensionFactory.DEFAULT);
    }

    public static Iq readIq(final String xml, final ExtensionFactory extensionFactory)
            throws IOException {
        final XmlReader xmlReader = new XmlReader(extensionFactory);
        xmlReader.setReader(new StringReader(xml));
        return Iq.decode(xmlReader, xmlReader.readStartTag());
    }

    public static Iq readIq(final byte[] bytes) throws IOException {
        final XmlReader xmlReader = new XmlReader();
        xmlReader.setInputStream(ByteSource.wrap(bytes).openStream());
        return Iq.decode(xmlReader, xmlReader.readStartTag());
    }

    private XmlElementReader() {}
}
