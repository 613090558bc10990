package im.conversations.iq.xml;

import java.io.IOException;

public interface Encodable {

    void encode(XmlWriter writer) throws IOException;
}
