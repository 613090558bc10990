package im.conversations.iq.xmpp.model.disco.info;

import im.conversations.iq.xml.Encodable;
import im.conversations.iq.xml.Tag;
import im.conversations.iq.xml.XmlWriter;
import java.io.IOException;

public class Identity implements Encodable {

    public static final String NAME = "identity";

    private String category;
    private String type;
    private String name;
    private String lang;

    public Identity() {}

    public Identity(final String category, final String type, final String name) {
        this.category = category;
        this.type = type;
        this.name = name;
    }

    static Identity of(final Tag tag) {
        final Identity identity =
                new Identity(
                        tag.getAttribute("category"),
                        tag.getAttribute("type"),
                        tag.getAttribute("name"));
        identity.setLang(tag.getAttribute("xml:lang"));
        return identity;
    }

    public String getCategory() {
        return category;
    }

    public void setCategory(final String category) {
        this.category = category;
    }

    public String getType() {
        return type;
    }

    public void setType(final String type) {
        this.type = type;
    }

    public String getIdentityName() {
        return name;
    }

    public void setIdentityName(final String name) {
        this.name = name;
    }

    public String getLang() {
        return lang;
    }

    public void setLang(final String lang) {
        this.lang = lang;
    }

    @Override
    public void encode(final XmlWriter writer) throws IOException {
        writer.startElement(null, NAME)
                .attribute("category", category)
                .attribute("type", type)
                .attribute("name", name)
                .attribute("xml:lang", lang)
                .endElement();
    }
}
