package im.conversations.iq.xml;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import im.conversations.iq.xmpp.model.Payload;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Schema-less element tree. Payloads nobody registered a type for are decoded into nodes so
 * they survive a decode/encode cycle.
 *
 * <p>The raw inner markup is kept as {@link #getContent() content} but is not written back by
 * {@link #encode(XmlWriter)}; only the child nodes are. An element that holds nothing but text
 * therefore comes out empty when re-encoded.
 */
public class Node implements Payload {

    private QualifiedName qualifiedName;
    private final Map<String, String> attributes = new LinkedHashMap<>();
    private final Map<String, String> attributeNamespaces = new LinkedHashMap<>();
    private final Map<String, String> namespaceDeclarations = new LinkedHashMap<>();
    private final List<Node> children = new ArrayList<>();
    private String content;

    public Node() {}

    public Node(final String name, final String namespace) {
        this.qualifiedName = new QualifiedName(namespace, name);
    }

    public Node(final QualifiedName qualifiedName) {
        this.qualifiedName = Preconditions.checkNotNull(qualifiedName);
    }

    @Override
    public void decode(final XmlReader reader, final Tag start) throws IOException {
        this.qualifiedName = start.getQualifiedName();
        this.attributes.clear();
        this.attributeNamespaces.clear();
        this.namespaceDeclarations.clear();
        this.children.clear();
        for (final Map.Entry<String, String> declaration :
                start.getNamespaceDeclarations().entrySet()) {
            if (!declaration.getKey().isEmpty()) {
                this.namespaceDeclarations.put(declaration.getKey(), declaration.getValue());
            }
        }
        for (final Map.Entry<String, String> attribute : start.getAttributes().entrySet()) {
            if (!"xmlns".equals(attribute.getKey())) {
                setAttribute(
                        start.getAttributeNamespace(attribute.getKey()),
                        attribute.getKey(),
                        attribute.getValue());
            }
        }
        reader.beginCapture();
        Tag nextTag = reader.readRequiredTag();
        while (!nextTag.isEnd(start.getName())) {
            if (nextTag.isStart()) {
                final Node child = new Node();
                child.decode(reader, nextTag);
                this.children.add(child);
            }
            nextTag = reader.readRequiredTag();
        }
        this.content = reader.endCapture();
    }

    @Override
    public void encode(final XmlWriter writer) throws IOException {
        Preconditions.checkState(this.qualifiedName != null, "node has not been named");
        writer.startElement(qualifiedName.namespace, qualifiedName.name);
        for (final Map.Entry<String, String> declaration : this.namespaceDeclarations.entrySet()) {
            writer.declareNamespace(declaration.getKey(), declaration.getValue());
        }
        for (final Map.Entry<String, String> attribute : this.attributes.entrySet()) {
            writer.attribute(
                    this.attributeNamespaces.get(attribute.getKey()),
                    attribute.getKey(),
                    attribute.getValue());
        }
        for (final Node child : this.children) {
            child.encode(writer);
        }
        writer.endElement();
    }

    public QualifiedName getQualifiedName() {
        return this.qualifiedName;
    }

    public final String getName() {
        return qualifiedName == null ? null : qualifiedName.name;
    }

    public String getNamespace() {
        return qualifiedName == null ? null : qualifiedName.namespace;
    }

    public Node setAttribute(final String name, final String value) {
        return setAttribute(null, name, value);
    }

    /**
     * Sets a prefixed attribute such as {@code p:a} in {@code namespace}. The prefix is declared
     * when the node is encoded unless an enclosing element already binds it.
     */
    public Node setAttribute(final String namespace, final String name, final String value) {
        if (name != null && value != null) {
            this.attributes.put(name, value);
            if (Strings.isNullOrEmpty(namespace)) {
                this.attributeNamespaces.remove(name);
            } else {
                this.attributeNamespaces.put(name, namespace);
            }
        }
        return this;
    }

    public String getAttribute(final String name) {
        return this.attributes.get(name);
    }

    public String getAttributeNamespace(final String name) {
        return this.attributeNamespaces.get(name);
    }

    public void removeAttribute(final String name) {
        this.attributes.remove(name);
        this.attributeNamespaces.remove(name);
    }

    public Map<String, String> getAttributes() {
        return this.attributes;
    }

    /**
     * @return prefixes this element declares itself, mapped to their namespace
     */
    public Map<String, String> getNamespaceDeclarations() {
        return this.namespaceDeclarations;
    }

    public Node addChild(final Node child) {
        this.children.add(Preconditions.checkNotNull(child));
        return child;
    }

    public Node addChild(final String name, final String namespace) {
        return addChild(new Node(name, namespace));
    }

    public List<Node> getChildren() {
        return this.children;
    }

    public Node findChild(final String name) {
        for (final Node child : this.children) {
            if (name.equals(child.getName())) {
                return child;
            }
        }
        return null;
    }

    public Node findChild(final String name, final String namespace) {
        final QualifiedName needle = new QualifiedName(namespace, name);
        for (final Node child : this.children) {
            if (needle.equals(child.getQualifiedName())) {
                return child;
            }
        }
        return null;
    }

    public boolean hasChild(final String name, final String namespace) {
        return findChild(name, namespace) != null;
    }

    /**
     * @return the inner markup as it was read, or {@code null} for nodes that were built rather
     *     than decoded
     */
    public String getContent() {
        return this.content;
    }

    @Override
    public String toString() {
        return XmlElementWriter.write(this);
    }
}
