package im.conversations.iq.xmpp.model;

import im.conversations.iq.xml.QualifiedName;
import im.conversations.iq.xml.Tag;
import im.conversations.iq.xml.XmlElementWriter;
import im.conversations.iq.xml.XmlReader;
import im.conversations.iq.xml.XmlWriter;
import java.io.IOException;

/**
 * Base class for payloads with a known schema. Subclasses pick the attributes and children they
 * model out of the stream; children they do not know are skipped.
 */
public abstract class Extension implements Payload {

    private final QualifiedName qualifiedName;

    protected Extension(final String name, final String namespace) {
        this.qualifiedName = new QualifiedName(namespace, name);
    }

    public QualifiedName getQualifiedName() {
        return this.qualifiedName;
    }

    @Override
    public void decode(final XmlReader reader, final Tag start) throws IOException {
        decodeAttributes(start);
        Tag nextTag = reader.readRequiredTag();
        while (!nextTag.isEnd(start.getName())) {
            if (nextTag.isStart()) {
                decodeChild(reader, nextTag);
            }
            nextTag = reader.readRequiredTag();
        }
    }

    protected void decodeAttributes(final Tag start) {}

    /** Must consume the child up to and including its end tag. */
    protected void decodeChild(final XmlReader reader, final Tag child) throws IOException {
        reader.skip(child);
    }

    @Override
    public void encode(final XmlWriter writer) throws IOException {
        writer.startElement(qualifiedName.namespace, qualifiedName.name);
        encodeAttributes(writer);
        encodeChildren(writer);
        writer.endElement();
    }

    protected void encodeAttributes(final XmlWriter writer) {}

    protected void encodeChildren(final XmlWriter writer) throws IOException {}

    protected boolean isOwnChild(final Tag child, final String name) {
        return child.isStart(name, qualifiedName.namespace);
    }

    @Override
    public String toString() {
        return XmlElementWriter.write(this);
    }
}
