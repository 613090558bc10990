package im.conversations.iq.xmpp.model.bind;

import com.google.common.base.Strings;
import im.conversations.iq.xml.Namespace;
import im.conversations.iq.xml.Tag;
import im.conversations.iq.xml.XmlReader;
import im.conversations.iq.xml.XmlWriter;
import im.conversations.iq.xmpp.model.Extension;
import java.io.IOException;

/**
 * Resource binding. The client sends an optional {@code resource}, the server answers with the
 * full {@code jid} it bound.
 */
public class Bind extends Extension {

    public static final String NAME = "bind";

    private String resource;
    private String jid;

    public Bind() {
        super(NAME, Namespace.BIND);
    }

    public static Bind ofResource(final String resource) {
        final Bind bind = new Bind();
        bind.setResource(resource);
        return bind;
    }

    public String getResource() {
        return resource;
    }

    public void setResource(final String resource) {
        this.resource = resource;
    }

    public String getJid() {
        return jid;
    }

    public void setJid(final String jid) {
        this.jid = jid;
    }

    @Override
    protected void decodeChild(final XmlReader reader, final Tag child) throws IOException {
        if (isOwnChild(child, "resource")) {
            this.resource = reader.readText(child).trim();
        } else if (isOwnChild(child, "jid")) {
            this.jid = reader.readText(child).trim();
        } else {
            reader.skip(child);
        }
    }

    @Override
    protected void encodeChildren(final XmlWriter writer) throws IOException {
        if (!Strings.isNullOrEmpty(resource)) {
            writer.startElement(null, "resource").text(resource).endElement();
        }
        if (!Strings.isNullOrEmpty(jid)) {
            writer.startElement(null, "jid").text(jid).endElement();
        }
    }
}
