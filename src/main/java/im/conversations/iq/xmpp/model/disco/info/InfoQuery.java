package im.conversations.iq.xmpp.model.disco.info;

import com.google.common.base.Strings;
import com.google.common.collect.Collections2;
import com.google.common.collect.Iterables;
import im.conversations.iq.xml.Namespace;
import im.conversations.iq.xml.Tag;
import im.conversations.iq.xml.XmlReader;
import im.conversations.iq.xml.XmlWriter;
import im.conversations.iq.xmpp.model.Extension;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/** Service discovery information query ({@code disco#info}). */
public class InfoQuery extends Extension {

    public static final String NAME = "query";

    private String node;
    private final List<Identity> identities = new ArrayList<>();
    private final List<Feature> features = new ArrayList<>();

    public InfoQuery() {
        super(NAME, Namespace.DISCO_INFO);
    }

    public InfoQuery(final Collection<Identity> identities, final Collection<String> features) {
        this();
        this.identities.addAll(identities);
        this.features.addAll(Feature.of(features));
    }

    public void setNode(final String node) {
        this.node = node;
    }

    public String getNode() {
        return this.node;
    }

    public List<Identity> getIdentities() {
        return this.identities;
    }

    public void addIdentity(final Identity identity) {
        this.identities.add(identity);
    }

    public List<Feature> getFeatures() {
        return this.features;
    }

    public void addFeature(final String feature) {
        this.features.add(new Feature(feature));
    }

    public Collection<String> getFeatureStrings() {
        return Collections2.transform(features, Feature::getVar);
    }

    public boolean hasFeature(final String feature) {
        return Iterables.any(features, f -> feature.equals(f.getVar()));
    }

    public boolean hasIdentityWithCategoryAndType(final String category, final String type) {
        return Iterables.any(
                identities, i -> category.equals(i.getCategory()) && type.equals(i.getType()));
    }

    @Override
    protected void decodeAttributes(final Tag start) {
        this.node = start.getAttribute("node");
    }

    @Override
    protected void decodeChild(final XmlReader reader, final Tag child) throws IOException {
        if (isOwnChild(child, Identity.NAME)) {
            this.identities.add(Identity.of(child));
        } else if (isOwnChild(child, Feature.NAME)) {
            final String var = child.getAttribute("var");
            if (!Strings.isNullOrEmpty(var)) {
                this.features.add(new Feature(var));
            }
        }
        reader.skip(child);
    }

    @Override
    protected void encodeAttributes(final XmlWriter writer) {
        writer.attribute("node", node);
    }

    @Override
    protected void encodeChildren(final XmlWriter writer) throws IOException {
        for (final Identity identity : identities) {
            identity.encode(writer);
        }
        for (final Feature feature : features) {
            feature.encode(writer);
        }
    }
}
