package im.conversations.iq.xmpp.model.disco.items;

import com.google.common.collect.Collections2;
import im.conversations.iq.xml.Namespace;
import im.conversations.iq.xml.Tag;
import im.conversations.iq.xml.XmlReader;
import im.conversations.iq.xml.XmlWriter;
import im.conversations.iq.xmpp.model.Extension;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/** Service discovery items query ({@code disco#items}). */
public class ItemsQuery extends Extension {

    public static final String NAME = "query";

    private String node;
    private final List<Item> items = new ArrayList<>();

    public ItemsQuery() {
        super(NAME, Namespace.DISCO_ITEMS);
    }

    public void setNode(final String node) {
        this.node = node;
    }

    public String getNode() {
        return this.node;
    }

    public List<Item> getItems() {
        return this.items;
    }

    public void addItem(final Item item) {
        this.items.add(item);
    }

    public Collection<String> getJids() {
        return Collections2.filter(Collections2.transform(items, Item::getJid), Objects::nonNull);
    }

    @Override
    protected void decodeAttributes(final Tag start) {
        this.node = start.getAttribute("node");
    }

    @Override
    protected void decodeChild(final XmlReader reader, final Tag child) throws IOException {
        if (isOwnChild(child, Item.NAME)) {
            this.items.add(Item.of(child));
        }
        reader.skip(child);
    }

    @Override
    protected void encodeAttributes(final XmlWriter writer) {
        writer.attribute("node", node);
    }

    @Override
    protected void encodeChildren(final XmlWriter writer) throws IOException {
        for (final Item item : items) {
            item.encode(writer);
        }
    }
}
