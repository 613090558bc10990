package im.conversations.iq.xmpp.model.disco.info;

import com.google.common.base.Preconditions;
import com.google.common.collect.Collections2;
import com.google.common.collect.ImmutableList;
import im.conversations.iq.xml.Encodable;
import im.conversations.iq.xml.XmlWriter;
import java.io.IOException;
import java.util.Collection;

public class Feature implements Encodable {

    public static final String NAME = "feature";

    private final String var;

    public Feature(final String var) {
        this.var = Preconditions.checkNotNull(var, "feature var must not be null");
    }

    public static ImmutableList<Feature> of(final Collection<String> features) {
        return ImmutableList.copyOf(Collections2.transform(features, Feature::new));
    }

    public String getVar() {
        return this.var;
    }

    @Override
    public void encode(final XmlWriter writer) throws IOException {
        writer.startElement(null, NAME).attribute("var", var).endElement();
    }
}
