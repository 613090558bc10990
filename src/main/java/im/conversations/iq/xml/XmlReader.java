package im.conversations.iq.xml;

import com.google.common.base.Preconditions;
import im.conversations.iq.xmpp.ExtensionFactory;
import im.conversations.iq.xmpp.model.Payload;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import org.kxml2.io.KXmlParser;
import org.xmlpull.v1.XmlPullParser;
import org.xmlpull.v1.XmlPullParserException;

/**
 * Reads namespaced markup as a sequence of {@link Tag} tokens and hands first-level elements to
 * the payload implementations registered with its {@link ExtensionFactory}.
 *
 * <p>Decoders receive the reader positioned right after an element's start tag and must consume
 * everything up to and including the matching end tag.
 */
public class XmlReader implements Closeable {

    private final XmlPullParser parser;
    private final ExtensionFactory extensionFactory;
    private final Deque<Capture> captures = new ArrayDeque<>();
    private Reader reader;

    public XmlReader() {
        this(ExtensionFactory.DEFAULT);
    }

    public XmlReader(final ExtensionFactory extensionFactory) {
        this.extensionFactory = Preconditions.checkNotNull(extensionFactory);
        this.parser = new KXmlParser();
        try {
            this.parser.setFeature(XmlPullParser.FEATURE_PROCESS_NAMESPACES, true);
        } catch (final XmlPullParserException e) {
            throw new IllegalStateException("xml parser does not support namespaces", e);
        }
    }

    public ExtensionFactory getExtensionFactory() {
        return this.extensionFactory;
    }

    public void setInputStream(final InputStream inputStream) throws IOException {
        if (inputStream == null) {
            throw new IOException("input stream was null");
        }
        setReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8));
    }

    public void setReader(final Reader reader) throws IOException {
        if (reader == null) {
            throw new IOException("reader was null");
        }
        this.reader = reader;
        this.captures.clear();
        try {
            parser.setInput(reader);
        } catch (final XmlPullParserException e) {
            throw new IOException("error resetting parser", e);
        }
    }

    @Override
    public void close() {
        this.reader = null;
        this.captures.clear();
    }

    /**
     * @return the next start, end or text token, or {@code null} once the document (or the
     *     input) has ended
     */
    public Tag readTag() throws IOException {
        try {
            while (this.reader != null && parser.next() != XmlPullParser.END_DOCUMENT) {
                final int eventType = parser.getEventType();
                if (eventType == XmlPullParser.START_TAG) {
                    return record(startTag());
                } else if (eventType == XmlPullParser.END_TAG) {
                    return record(Tag.end(parser.getName()).setPrefix(parser.getPrefix()));
                } else if (eventType == XmlPullParser.TEXT) {
                    return record(Tag.no(parser.getText()));
                }
            }
        } catch (final XmlPullParserException | RuntimeException e) {
            throw new IOException(
                    String.format(
                            "xml parser mishandled %s(%s)",
                            e.getClass().getSimpleName(), e.getMessage()),
                    e);
        }
        return null;
    }

    private Tag startTag() throws XmlPullParserException {
        final Tag tag = Tag.start(parser.getName());
        tag.setPrefix(parser.getPrefix());
        tag.setNamespace(parser.getNamespace());
        final int depth = parser.getDepth();
        final int declarations = parser.getNamespaceCount(depth);
        for (int i = parser.getNamespaceCount(depth - 1); i < declarations; ++i) {
            tag.declareNamespace(parser.getNamespacePrefix(i), parser.getNamespaceUri(i));
        }
        for (int i = 0; i < parser.getAttributeCount(); ++i) {
            final String prefix = parser.getAttributePrefix(i);
            final String name;
            if (prefix != null && !prefix.isEmpty()) {
                name = prefix + ":" + parser.getAttributeName(i);
            } else {
                name = parser.getAttributeName(i);
            }
            tag.setAttribute(name, parser.getAttributeValue(i));
            tag.setAttributeNamespace(name, parser.getAttributeNamespace(i));
        }
        return tag;
    }

    /** Like {@link #readTag()} but treats the end of input as a truncated element. */
    public Tag readRequiredTag() throws IOException {
        final Tag tag = readTag();
        if (tag == null) {
            throw new IOException("interrupted mid tag");
        }
        return tag;
    }

    /** Reads the first start tag of the document, skipping any leading character data. */
    public Tag readStartTag() throws IOException {
        Tag tag = readRequiredTag();
        while (tag.isNo()) {
            tag = readRequiredTag();
        }
        if (!tag.isStart()) {
            throw new IOException("expected start tag but got " + tag);
        }
        return tag;
    }

    /**
     * Resolves the element started by {@code start} through the extension factory and lets the
     * resulting payload decode itself.
     */
    public Payload readPayload(final Tag start) throws IOException {
        final Payload payload = extensionFactory.create(start.getNamespace(), start.getName());
        payload.decode(this, start);
        return payload;
    }

    /** Collects the character data of the element; nested elements are skipped. */
    public String readText(final Tag start) throws IOException {
        final StringBuilder text = new StringBuilder();
        Tag nextTag = readRequiredTag();
        while (!nextTag.isEnd(start.getName())) {
            if (nextTag.isNo()) {
                text.append(nextTag.getName());
            } else if (nextTag.isStart()) {
                skip(nextTag);
            }
            nextTag = readRequiredTag();
        }
        return text.toString();
    }

    /** Consumes the remainder of the element started by {@code start}. */
    public void skip(final Tag start) throws IOException {
        Tag nextTag = readRequiredTag();
        while (!nextTag.isEnd(start.getName())) {
            if (nextTag.isStart()) {
                skip(nextTag);
            }
            nextTag = readRequiredTag();
        }
    }

    /**
     * Starts recording the re-serialized form of every token read from here on. Captures nest;
     * each {@link #endCapture()} closes the innermost one.
     */
    public void beginCapture() {
        this.captures.push(new Capture());
    }

    /**
     * Closes the innermost capture. Called right after reading the end tag of the captured
     * element; that end tag is not part of the result.
     */
    public String endCapture() {
        final Capture capture = this.captures.pop();
        final StringBuilder builder = capture.builder;
        builder.setLength(builder.length() - capture.lastTokenLength);
        return builder.toString();
    }

    private Tag record(final Tag tag) {
        if (!this.captures.isEmpty()) {
            final String token = tag.toString();
            for (final Capture capture : this.captures) {
                capture.builder.append(token);
                capture.lastTokenLength = token.length();
            }
        }
        return tag;
    }

    private static final class Capture {
        private final StringBuilder builder = new StringBuilder();
        private int lastTokenLength = 0;
    }
}
