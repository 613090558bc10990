package im.conversations.iq.xml;

public final class Namespace {
    public static final String XML = "http://www.w3.org/XML/1998/namespace";
    public static final String XMLNS = "http://www.w3.org/2000/xmlns/";
    public static final String STANZAS = "urn:ietf:params:xml:ns:xmpp-stanzas";
    public static final String JABBER_CLIENT = "jabber:client";
    public static final String JABBER_SERVER = "jabber:server";
    public static final String DISCO_ITEMS = "http://jabber.org/protocol/disco#items";
    public static final String DISCO_INFO = "http://jabber.org/protocol/disco#info";
    public static final String BIND = "urn:ietf:params:xml:ns:xmpp-bind";
    public static final String IOT_CONTROL = "urn:xmpp:iot:control";

    private Namespace() {}
}
