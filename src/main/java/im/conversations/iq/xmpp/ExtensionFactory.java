package im.conversations.iq.xmpp;

import com.google.common.base.Preconditions;
import im.conversations.iq.Config;
import im.conversations.iq.xml.Namespace;
import im.conversations.iq.xml.Node;
import im.conversations.iq.xml.QualifiedName;
import im.conversations.iq.xmpp.model.Payload;
import im.conversations.iq.xmpp.model.bind.Bind;
import im.conversations.iq.xmpp.model.disco.info.InfoQuery;
import im.conversations.iq.xmpp.model.disco.items.ItemsQuery;
import im.conversations.iq.xmpp.model.iot.ControlSet;
import im.conversations.iq.xmpp.model.iot.ControlSetResponse;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps the qualified name of a payload element to the type that decodes it. Anything without
 * an entry decodes into a {@link Node}.
 *
 * <p>Entries are meant to be registered during start-up, before the first decode. The table only
 * ever grows; lookups take no locks.
 */
public final class ExtensionFactory {

    private static final Logger LOGGER = LoggerFactory.getLogger(Config.LOGTAG);

    /** Shared registry used by readers that are not handed one explicitly. */
    public static final ExtensionFactory DEFAULT = withDefaults();

    private final ConcurrentMap<QualifiedName, Supplier<? extends Payload>> factories =
            new ConcurrentHashMap<>();

    private ExtensionFactory() {}

    public static ExtensionFactory empty() {
        return new ExtensionFactory();
    }

    public static ExtensionFactory withDefaults() {
        final ExtensionFactory extensionFactory = new ExtensionFactory();
        extensionFactory.register(Namespace.DISCO_INFO, InfoQuery.NAME, InfoQuery::new);
        extensionFactory.register(Namespace.DISCO_ITEMS, ItemsQuery.NAME, ItemsQuery::new);
        extensionFactory.register(Namespace.BIND, Bind.NAME, Bind::new);
        extensionFactory.register(Namespace.IOT_CONTROL, ControlSet.NAME, ControlSet::new);
        extensionFactory.register(
                Namespace.IOT_CONTROL, ControlSetResponse.NAME, ControlSetResponse::new);
        return extensionFactory;
    }

    /**
     * @throws IllegalArgumentException if the qualified name has already been registered
     */
    public ExtensionFactory register(
            final String namespace, final String name, final Supplier<? extends Payload> factory) {
        Preconditions.checkNotNull(factory, "factory must not be null");
        final QualifiedName id = new QualifiedName(namespace, name);
        final Supplier<? extends Payload> previous = factories.putIfAbsent(id, factory);
        Preconditions.checkArgument(previous == null, "%s has already been registered", id);
        return this;
    }

    public boolean isRegistered(final String namespace, final String name) {
        return factories.containsKey(new QualifiedName(namespace, name));
    }

    /**
     * @return a fresh instance of the registered type, or a fresh {@link Node} if there is none or
     *     the registered factory fails to produce a payload
     */
    public Payload create(final String namespace, final String name) {
        final QualifiedName id = new QualifiedName(namespace, name);
        final Supplier<? extends Payload> factory = factories.get(id);
        if (factory == null) {
            LOGGER.debug("no extension registered for {}", id);
            return new Node(id);
        }
        final Payload payload;
        try {
            payload = factory.get();
        } catch (final RuntimeException e) {
            LOGGER.warn("unable to create extension for {}. falling back to generic node", id, e);
            return new Node(id);
        }
        if (payload == null) {
            LOGGER.warn("extension factory for {} returned null. falling back to generic node", id);
            return new Node(id);
        }
        return payload;
    }
}
