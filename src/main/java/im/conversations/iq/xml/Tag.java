package im.conversations.iq.xml;

import com.google.common.base.Strings;
import com.google.common.xml.XmlEscapers;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One markup token as read from or written to a stream. For {@link #NO} tokens (character data)
 * the name holds the text.
 */
public class Tag {
    public static final int NO = -1;
    public static final int START = 0;
    public static final int END = 1;
    public static final int EMPTY = 2;

    protected final int type;
    protected final String name;
    protected String prefix;
    protected String namespace = "";
    protected Map<String, String> attributes = new LinkedHashMap<>();
    protected final Map<String, String> namespaceDeclarations = new LinkedHashMap<>();
    protected final Map<String, String> attributeNamespaces = new LinkedHashMap<>();

    protected Tag(int type, String name) {
        this.type = type;
        this.name = name;
    }

    public static Tag no(String text) {
        return new Tag(NO, text);
    }

    public static Tag start(String name) {
        return new Tag(START, name);
    }

    public static Tag end(String name) {
        return new Tag(END, name);
    }

    public static Tag empty(String name) {
        return new Tag(EMPTY, name);
    }

    public String getName() {
        return name;
    }

    public String getPrefix() {
        return prefix;
    }

    public Tag setPrefix(final String prefix) {
        this.prefix = prefix;
        return this;
    }

    public String getNamespace() {
        return namespace;
    }

    public Tag setNamespace(final String namespace) {
        this.namespace = Strings.nullToEmpty(namespace);
        return this;
    }

    public QualifiedName getQualifiedName() {
        return new QualifiedName(namespace, name);
    }

    public String getAttribute(final String attrName) {
        return this.attributes.get(attrName);
    }

    public Tag setAttribute(final String attrName, final String attrValue) {
        this.attributes.put(attrName, attrValue);
        return this;
    }

    public void setAttributes(final Map<String, String> attributes) {
        this.attributes = attributes;
    }

    public Map<String, String> getAttributes() {
        return this.attributes;
    }

    /**
     * @return the namespace a prefixed attribute was read in, or {@code null} for attributes
     *     without a namespace
     */
    public String getAttributeNamespace(final String attrName) {
        return this.attributeNamespaces.get(attrName);
    }

    public Tag setAttributeNamespace(final String attrName, final String uri) {
        if (Strings.isNullOrEmpty(uri)) {
            this.attributeNamespaces.remove(attrName);
        } else {
            this.attributeNamespaces.put(attrName, uri);
        }
        return this;
    }

    public Tag declareNamespace(final String prefix, final String uri) {
        this.namespaceDeclarations.put(Strings.nullToEmpty(prefix), Strings.nullToEmpty(uri));
        return this;
    }

    public Map<String, String> getNamespaceDeclarations() {
        return this.namespaceDeclarations;
    }

    public boolean isStart(final String needle) {
        if (needle == null) {
            return false;
        }
        return (this.type == START) && (needle.equals(this.name));
    }

    public boolean isStart(final String name, final String namespace) {
        return isStart(name) && namespace != null && namespace.equals(this.namespace);
    }

    public boolean isStart() {
        return this.type == START;
    }

    public boolean isEnd(String needle) {
        if (needle == null) return false;
        return (this.type == END) && (needle.equals(this.name));
    }

    public boolean isNo() {
        return (this.type == NO);
    }

    Tag asEmpty() {
        final Tag tag = Tag.empty(name).setPrefix(prefix).setNamespace(namespace);
        tag.attributes = this.attributes;
        tag.namespaceDeclarations.putAll(this.namespaceDeclarations);
        tag.attributeNamespaces.putAll(this.attributeNamespaces);
        return tag;
    }

    @Override
    public String toString() {
        if (type == NO) {
            return XmlEscapers.xmlContentEscaper().escape(Strings.nullToEmpty(name));
        }
        final StringBuilder tagOutput = new StringBuilder();
        tagOutput.append('<');
        if (type == END) {
            tagOutput.append('/');
        }
        if (!Strings.isNullOrEmpty(prefix)) {
            tagOutput.append(prefix).append(':');
        }
        tagOutput.append(name);
        if (type != END) {
            for (final Map.Entry<String, String> declaration : namespaceDeclarations.entrySet()) {
                tagOutput.append(" xmlns");
                if (!declaration.getKey().isEmpty()) {
                    tagOutput.append(':').append(declaration.getKey());
                }
                appendValue(tagOutput, declaration.getValue());
            }
            for (final Map.Entry<String, String> entry : attributes.entrySet()) {
                tagOutput.append(' ');
                tagOutput.append(entry.getKey());
                appendValue(tagOutput, entry.getValue());
            }
        }
        if (type == EMPTY) {
            tagOutput.append('/');
        }
        tagOutput.append('>');
        return tagOutput.toString();
    }

    private static void appendValue(final StringBuilder output, final String value) {
        output.append("=\"");
        output.append(XmlEscapers.xmlAttributeEscaper().escape(Strings.nullToEmpty(value)));
        output.append('"');
    }
}
