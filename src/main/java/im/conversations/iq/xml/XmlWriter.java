package im.conversations.iq.xml;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableSet;
import java.io.Flushable;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Writes {@link Tag} tokens to a character stream. A start tag is held back until its first
 * child or text arrives so that elements without content come out as empty tags. The default
 * namespace is only declared where an element's namespace differs from the one in scope, and a
 * prefix of a namespaced attribute only where it is not bound to that namespace already.
 */
public class XmlWriter implements Flushable {

    private static final ImmutableSet<String> RESERVED_PREFIXES = ImmutableSet.of("xml", "xmlns");

    private final Writer writer;
    private final Deque<Tag> openElements = new ArrayDeque<>();
    private Tag pending;

    public XmlWriter(final Writer writer) {
        this.writer = Preconditions.checkNotNull(writer);
    }

    public XmlWriter(final OutputStream outputStream) {
        this(new OutputStreamWriter(outputStream, StandardCharsets.UTF_8));
    }

    /**
     * @param namespace namespace of the element, {@code null} to stay in the namespace of the
     *     enclosing element
     */
    public XmlWriter startElement(final String namespace, final String name) throws IOException {
        Preconditions.checkArgument(!Strings.isNullOrEmpty(name), "element name must not be empty");
        writePending();
        final String inScope = defaultNamespace();
        final Tag tag = Tag.start(name);
        tag.setNamespace(namespace == null ? inScope : namespace);
        if (!tag.getNamespace().equals(inScope)) {
            tag.declareNamespace("", tag.getNamespace());
        }
        this.pending = tag;
        this.openElements.push(tag);
        return this;
    }

    public XmlWriter startElement(final QualifiedName qualifiedName) throws IOException {
        return startElement(qualifiedName.namespace, qualifiedName.name);
    }

    /** Adds an attribute to the element just started. {@code null} values are skipped. */
    public XmlWriter attribute(final String name, final String value) {
        return attribute(null, name, value);
    }

    /**
     * Adds an attribute to the element just started. For a prefixed name in a namespace the prefix
     * is declared on the element unless an enclosing element binds it to that namespace.
     */
    public XmlWriter attribute(final String namespace, final String name, final String value) {
        final Tag start = requirePending();
        if (name == null || value == null) {
            return this;
        }
        final int separator = name.indexOf(':');
        if (!Strings.isNullOrEmpty(namespace) && separator > 0) {
            final String prefix = name.substring(0, separator);
            if (!RESERVED_PREFIXES.contains(prefix) && !namespace.equals(resolvePrefix(prefix))) {
                final String bound = start.getNamespaceDeclarations().get(prefix);
                Preconditions.checkArgument(
                        bound == null, "prefix %s is already bound to %s", prefix, bound);
                start.declareNamespace(prefix, namespace);
            }
        }
        start.setAttribute(name, value);
        return this;
    }

    /** Binds {@code prefix} to {@code uri} on the element just started. */
    public XmlWriter declareNamespace(final String prefix, final String uri) {
        Preconditions.checkArgument(!Strings.isNullOrEmpty(prefix), "prefix must not be empty");
        Preconditions.checkArgument(!Strings.isNullOrEmpty(uri), "namespace must not be empty");
        requirePending().declareNamespace(prefix, uri);
        return this;
    }

    public XmlWriter text(final String text) throws IOException {
        if (Strings.isNullOrEmpty(text)) {
            return this;
        }
        if (this.openElements.isEmpty()) {
            throw new IllegalStateException("text outside of an element");
        }
        writePending();
        this.writer.write(Tag.no(text).toString());
        return this;
    }

    public XmlWriter endElement() throws IOException {
        final Tag start = this.openElements.poll();
        if (start == null) {
            throw new IllegalStateException("no element left to close");
        }
        if (this.pending == start) {
            this.pending = null;
            this.writer.write(start.asEmpty().toString());
        } else {
            this.writer.write(Tag.end(start.getName()).toString());
        }
        return this;
    }

    public void writeElement(final Encodable element) throws IOException {
        element.encode(this);
        flush();
    }

    @Override
    public void flush() throws IOException {
        writePending();
        this.writer.flush();
    }

    private void writePending() throws IOException {
        if (this.pending != null) {
            this.writer.write(this.pending.toString());
            this.pending = null;
        }
    }

    private Tag requirePending() {
        if (this.pending == null) {
            throw new IllegalStateException("attributes can only follow a start tag");
        }
        return this.pending;
    }

    private String resolvePrefix(final String prefix) {
        for (final Tag open : this.openElements) {
            final String uri = open.getNamespaceDeclarations().get(prefix);
            if (uri != null) {
                return uri;
            }
        }
        return null;
    }

    private String defaultNamespace() {
        final Tag parent = this.openElements.peek();
        return parent == null ? "" : parent.getNamespace();
    }
}
