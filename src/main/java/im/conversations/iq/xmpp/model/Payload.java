package im.conversations.iq.xmpp.model;

import im.conversations.iq.xml.Encodable;
import im.conversations.iq.xml.Tag;
import im.conversations.iq.xml.XmlReader;
import java.io.IOException;

/**
 * Anything that may be carried as a child of an {@code <iq/>}. Implementations are created
 * through the {@link im.conversations.iq.xmpp.ExtensionFactory} and need a public no-argument
 * constructor or an equivalent factory.
 */
public interface Payload extends Encodable {

    /**
     * Populates this payload from the element started by {@code start}. On return the reader
     * must be positioned on the matching end tag.
     */
    void decode(XmlReader reader, Tag start) throws IOException;
}
