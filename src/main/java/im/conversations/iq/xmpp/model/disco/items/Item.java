package im.conversations.iq.xmpp.model.disco.items;

import im.conversations.iq.xml.Encodable;
import im.conversations.iq.xml.Tag;
import im.conversations.iq.xml.XmlWriter;
import java.io.IOException;

public class Item implements Encodable {

    public static final String NAME = "item";

    private final String jid;
    private final String name;
    private final String node;

    public Item(final String jid, final String name, final String node) {
        this.jid = jid;
        this.name = name;
        this.node = node;
    }

    static Item of(final Tag tag) {
        return new Item(
                tag.getAttribute("jid"), tag.getAttribute("name"), tag.getAttribute("node"));
    }

    public String getJid() {
        return jid;
    }

    public String getItemName() {
        return name;
    }

    public String getNode() {
        return node;
    }

    @Override
    public void encode(final XmlWriter writer) throws IOException {
        writer.startElement(null, NAME)
                .attribute("jid", jid)
                .attribute("name", name)
                .attribute("node", node)
                .endElement();
    }
}
