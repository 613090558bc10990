package im.conversations.iq.xmpp.model.stanza;

import com.google.common.base.Strings;
import com.google.common.collect.Collections2;
import com.google.common.collect.Iterables;
import im.conversations.iq.Config;
import im.conversations.iq.xml.Encodable;
import im.conversations.iq.xml.Tag;
import im.conversations.iq.xml.XmlElementWriter;
import im.conversations.iq.xml.XmlReader;
import im.conversations.iq.xml.XmlWriter;
import im.conversations.iq.xmpp.model.Payload;
import im.conversations.iq.xmpp.model.error.Error;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An Info/Query stanza. Carries addressing, an id, the request type, the payloads found as its
 * direct children (in document order) and optionally a stanza error.
 */
public class Iq implements Encodable {

    private static final Logger LOGGER = LoggerFactory.getLogger(Config.LOGTAG);

    public static final String NAME = "iq";

    private String namespace = "";
    private String type;
    private String from;
    private String to;
    private String id;
    private String lang;
    private final List<Payload> payloads = new ArrayList<>();
    private String rawXml = "";
    private Error error;

    private Iq() {}

    public Iq(final Type type) {
        this.type = type == null ? null : type.toString();
    }

    public Iq(
            final Type type,
            final String from,
            final String to,
            final String id,
            final String lang) {
        this(type);
        this.from = from;
        this.to = to;
        this.id = id;
        this.lang = lang;
    }

    public enum Type {
        GET,
        SET,
        RESULT,
        ERROR;

        /**
         * @return the type whose wire name is exactly {@code type}, or {@code null}
         */
        public static Type valueOfOrNull(final String type) {
            for (final Type candidate : values()) {
                if (candidate.toString().equals(type)) {
                    return candidate;
                }
            }
            return null;
        }

        @Override
        public String toString() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    /**
     * @return the request type, or {@code null} if the type attribute is missing or not one of
     *     {@code get}, {@code set}, {@code result} and {@code error}
     */
    public Type getType() {
        return Type.valueOfOrNull(type);
    }

    /**
     * @return the type attribute as it was read. It is written back unchanged, including values
     *     {@link #getType()} does not recognize.
     */
    public String getRawType() {
        return type;
    }

    public String getFrom() {
        return from;
    }

    public String getTo() {
        return to;
    }

    public String getId() {
        return id;
    }

    public String getLang() {
        return lang;
    }

    /**
     * @return the namespace the stanza was read in ({@code jabber:client} on a client stream),
     *     empty for stanzas built locally
     */
    public String getNamespace() {
        return namespace;
    }

    public void addPayload(final Payload payload) {
        if (payload == null) {
            throw new IllegalArgumentException("payload must not be null");
        }
        this.payloads.add(payload);
    }

    public List<Payload> getPayloads() {
        return Collections.unmodifiableList(this.payloads);
    }

    public <E extends Payload> E getExtension(final Class<E> clazz) {
        final Payload payload = Iterables.find(this.payloads, clazz::isInstance, null);
        return payload == null ? null : clazz.cast(payload);
    }

    public <E extends Payload> Collection<E> getExtensions(final Class<E> clazz) {
        return Collections2.transform(
                Collections2.filter(this.payloads, clazz::isInstance), clazz::cast);
    }

    /**
     * @return the inner markup of a decoded stanza as it was read; empty for stanzas built locally
     */
    public String getRawXml() {
        return rawXml;
    }

    /**
     * @return the stanza error, or {@code null} if the stanza carries none
     */
    public Error getError() {
        return error;
    }

    /**
     * Derives the error reply to this stanza. The reply is addressed back to the sender and keeps
     * the id, the language and all payloads of this stanza.
     */
    public Iq makeErrorResponse(final Error error) {
        final Iq response = new Iq(Type.ERROR, this.to, this.from, this.id, this.lang);
        response.namespace = this.namespace;
        response.payloads.addAll(this.payloads);
        response.error = error;
        return response;
    }

    /** Creates an empty reply of the given type addressed back to the sender. */
    public Iq generateResponse(final Type type) {
        final Iq response = new Iq(type, this.to, this.from, this.id, this.lang);
        response.namespace = this.namespace;
        return response;
    }

    /**
     * Decodes the stanza started by {@code start}. Every direct child is resolved through the
     * reader's extension factory, except for an {@code <error/>} in the stanza's own namespace
     * which becomes the stanza error.
     */
    public static Iq decode(final XmlReader reader, final Tag start) throws IOException {
        if (!start.isStart(NAME)) {
            throw new IOException(String.format("expected <iq/> but got <%s/>", start.getName()));
        }
        final Iq iq = new Iq();
        iq.namespace = start.getNamespace();
        iq.id = start.getAttribute("id");
        iq.from = start.getAttribute("from");
        iq.to = start.getAttribute("to");
        final String lang = start.getAttribute("xml:lang");
        iq.lang = lang != null ? lang : start.getAttribute("lang");
        iq.type = start.getAttribute("type");
        if (iq.getType() == null) {
            LOGGER.debug("iq {} has unknown type {}", iq.id, iq.type);
        }
        reader.beginCapture();
        Tag nextTag = reader.readRequiredTag();
        while (!nextTag.isEnd(start.getName())) {
            if (nextTag.isStart(Error.NAME, iq.namespace)) {
                final Error error = new Error();
                error.decode(reader, nextTag);
                iq.error = error;
            } else if (nextTag.isStart()) {
                iq.payloads.add(reader.readPayload(nextTag));
            }
            nextTag = reader.readRequiredTag();
        }
        iq.rawXml = reader.endCapture();
        return iq;
    }

    @Override
    public void encode(final XmlWriter writer) throws IOException {
        writer.startElement(Strings.emptyToNull(namespace), NAME);
        writer.attribute("id", id);
        writer.attribute("type", type);
        writer.attribute("from", from);
        writer.attribute("to", to);
        writer.attribute("xml:lang", lang);
        for (final Payload payload : payloads) {
            payload.encode(writer);
        }
        if (error != null) {
            error.encode(writer);
        }
        writer.endElement();
    }

    @Override
    public String toString() {
        return XmlElementWriter.write(this);
    }
}
