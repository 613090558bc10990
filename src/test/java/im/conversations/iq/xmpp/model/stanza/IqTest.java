package im.conversations.iq.xmpp.model.stanza;

import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.MatcherAssert.assertThat;

import im.conversations.iq.xml.Namespace;
import im.conversations.iq.xml.Node;
import im.conversations.iq.xml.XmlElementReader;
import im.conversations.iq.xmpp.model.bind.Bind;
import im.conversations.iq.xmpp.model.disco.info.InfoQuery;
import im.conversations.iq.xmpp.model.disco.items.ItemsQuery;
import im.conversations.iq.xmpp.model.error.Condition;
import im.conversations.iq.xmpp.model.error.Error;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import org.junit.Assert;
import org.junit.Test;

public class IqTest {

    @Test
    public void discoItemsSet() throws IOException {
        final Iq iq =
                XmlElementReader.readIq(
                        "<iq type=\"set\" id=\"1\">"
                                + "<query xmlns=\"http://jabber.org/protocol/disco#items\"/></iq>");
        Assert.assertEquals(Iq.Type.SET, iq.getType());
        Assert.assertEquals("1", iq.getId());
        Assert.assertEquals(1, iq.getPayloads().size());
        assertThat(iq.getPayloads().get(0), instanceOf(ItemsQuery.class));
        final ItemsQuery query = (ItemsQuery) iq.getPayloads().get(0);
        Assert.assertTrue(query.getItems().isEmpty());
        Assert.assertNull(iq.getError());
    }

    @Test
    public void errorWithLegacyCode() throws IOException {
        final Iq iq =
                XmlElementReader.readIq(
                        "<iq type=\"error\" id=\"2\"><error code=\"404\" type=\"cancel\">"
                                + "<item-not-found xmlns=\"urn:ietf:params:xml:ns:xmpp-stanzas\"/>"
                                + "</error></iq>");
        Assert.assertEquals(Iq.Type.ERROR, iq.getType());
        Assert.assertTrue(iq.getPayloads().isEmpty());
        final Error error = iq.getError();
        Assert.assertNotNull(error);
        Assert.assertEquals(404, error.getCode());
        Assert.assertEquals("cancel", error.getType());
        Assert.assertEquals("item-not-found", error.getReason());
        Assert.assertEquals("", error.getText());
    }

    @Test
    public void attributes() throws IOException {
        final Iq iq =
                XmlElementReader.readIq(
                        """
                        <iq from='juliet@example.com/balcony'
                            to='example.com'
                            id='info1'
                            type='get'
                            xml:lang='en'/>\
                        """);
        Assert.assertEquals("juliet@example.com/balcony", iq.getFrom());
        Assert.assertEquals("example.com", iq.getTo());
        Assert.assertEquals("info1", iq.getId());
        Assert.assertEquals(Iq.Type.GET, iq.getType());
        Assert.assertEquals("en", iq.getLang());
        Assert.assertTrue(iq.getPayloads().isEmpty());
        Assert.assertEquals("", iq.getRawXml());
    }

    @Test
    public void unknownTypeIsKeptVerbatim() throws IOException {
        final Iq iq = XmlElementReader.readIq("<iq type='query' id='x'/>");
        Assert.assertNull(iq.getType());
        Assert.assertEquals("query", iq.getRawType());
        Assert.assertEquals("x", iq.getId());
        Assert.assertEquals("<iq id=\"x\" type=\"query\"/>", iq.toString());
    }

    @Test
    public void typeIsMatchedCaseSensitively() throws IOException {
        final Iq iq = XmlElementReader.readIq("<iq type='SET' id='u'/>");
        Assert.assertNull(iq.getType());
        Assert.assertEquals("SET", iq.getRawType());
        Assert.assertEquals("<iq id=\"u\" type=\"SET\"/>", iq.toString());
    }

    @Test
    public void missingTypeIsNotWritten() throws IOException {
        final Iq iq = XmlElementReader.readIq("<iq id='m'/>");
        Assert.assertNull(iq.getType());
        Assert.assertNull(iq.getRawType());
        Assert.assertEquals("<iq id=\"m\"/>", iq.toString());
    }

    @Test
    public void payloadsKeepDocumentOrder() throws IOException {
        final Iq iq =
                XmlElementReader.readIq(
                        """
                        <iq type='result' id='multi'>
                          <bind xmlns='urn:ietf:params:xml:ns:xmpp-bind'/>
                          <unknown xmlns='urn:example'><nested/></unknown>
                          <query xmlns='http://jabber.org/protocol/disco#info'/>
                          <bind xmlns='urn:ietf:params:xml:ns:xmpp-bind'/>
                        </iq>\
                        """
                                .getBytes(StandardCharsets.UTF_8));
        Assert.assertEquals(4, iq.getPayloads().size());
        assertThat(iq.getPayloads().get(0), instanceOf(Bind.class));
        assertThat(iq.getPayloads().get(1), instanceOf(Node.class));
        assertThat(iq.getPayloads().get(2), instanceOf(InfoQuery.class));
        assertThat(iq.getPayloads().get(3), instanceOf(Bind.class));
        Assert.assertEquals(2, iq.getExtensions(Bind.class).size());
        Assert.assertNotNull(iq.getExtension(InfoQuery.class));
        Assert.assertNull(iq.getExtension(ItemsQuery.class));
    }

    @Test
    public void errorInStreamNamespace() throws IOException {
        final String xml =
                "<iq xmlns=\"jabber:client\" id=\"7\" type=\"error\">"
                        + "<error code=\"400\" type=\"modify\">"
                        + "<bad-request xmlns=\"urn:ietf:params:xml:ns:xmpp-stanzas\"/>"
                        + "</error></iq>";
        final Iq iq = XmlElementReader.readIq(xml);
        Assert.assertEquals(Namespace.JABBER_CLIENT, iq.getNamespace());
        Assert.assertEquals(400, iq.getError().getCode());
        Assert.assertEquals(Condition.BAD_REQUEST, iq.getError().getCondition());
        Assert.assertTrue(iq.getPayloads().isEmpty());
        Assert.assertEquals(xml, iq.toString());
    }

    @Test
    public void errorInForeignNamespaceIsPayload() throws IOException {
        final Iq iq =
                XmlElementReader.readIq(
                        "<iq type='result' id='8'><error xmlns='urn:example' code='1'/></iq>");
        Assert.assertNull(iq.getError());
        Assert.assertEquals(1, iq.getPayloads().size());
        assertThat(iq.getPayloads().get(0), instanceOf(Node.class));
    }

    @Test
    public void rawXmlIsCaptured() throws IOException {
        final Iq iq =
                XmlElementReader.readIq(
                        "<iq type='set' id='1'>"
                                + "<query xmlns='http://jabber.org/protocol/disco#items'"
                                + " node='music'/></iq>");
        Assert.assertEquals(
                "<query xmlns=\"http://jabber.org/protocol/disco#items\" node=\"music\"></query>",
                iq.getRawXml());
        Assert.assertEquals("music", iq.getExtension(ItemsQuery.class).getNode());
    }

    @Test(expected = IOException.class)
    public void otherStanzaIsRejected() throws IOException {
        XmlElementReader.readIq("<message type='chat' id='1'><body>hi</body></message>");
    }

    @Test(expected = IOException.class)
    public void truncatedStanza() throws IOException {
        XmlElementReader.readIq("<iq type='get' id='1'><query xmlns='urn:x'><item/>");
    }

    @Test
    public void construct() {
        final Iq iq = new Iq(Iq.Type.GET, "juliet@example.com/balcony", "example.com", "5", "en");
        Assert.assertEquals(Iq.Type.GET, iq.getType());
        Assert.assertEquals("juliet@example.com/balcony", iq.getFrom());
        Assert.assertEquals("example.com", iq.getTo());
        Assert.assertEquals("5", iq.getId());
        Assert.assertEquals("en", iq.getLang());
        Assert.assertTrue(iq.getPayloads().isEmpty());
        Assert.assertNull(iq.getError());
        Assert.assertEquals(
                "<iq id=\"5\" type=\"get\" from=\"juliet@example.com/balcony\""
                        + " to=\"example.com\" xml:lang=\"en\"/>",
                iq.toString());
    }

    @Test
    public void addPayloadAllowsRepeats() {
        final Iq iq = new Iq(Iq.Type.SET);
        final Bind first = Bind.ofResource("one");
        final Bind second = Bind.ofResource("two");
        iq.addPayload(first);
        iq.addPayload(second);
        iq.addPayload(first);
        Assert.assertEquals(3, iq.getPayloads().size());
        Assert.assertSame(first, iq.getPayloads().get(0));
        Assert.assertSame(second, iq.getPayloads().get(1));
        Assert.assertSame(first, iq.getPayloads().get(2));
    }

    @Test(expected = UnsupportedOperationException.class)
    public void payloadListIsReadOnly() {
        new Iq(Iq.Type.GET).getPayloads().add(new ItemsQuery());
    }

    @Test
    public void encode() {
        final Iq iq =
                new Iq(Iq.Type.GET, "juliet@example.com/balcony", "example.com", "items1", null);
        final ItemsQuery query = new ItemsQuery();
        query.setNode("music");
        iq.addPayload(query);
        Assert.assertEquals(
                "<iq id=\"items1\" type=\"get\" from=\"juliet@example.com/balcony\""
                        + " to=\"example.com\">"
                        + "<query xmlns=\"http://jabber.org/protocol/disco#items\" node=\"music\"/>"
                        + "</iq>",
                iq.toString());
    }

    /** Error replies carry the payload of the request they answer. */
    @Test
    public void makeErrorResponse() {
        final Iq request =
                new Iq(Iq.Type.GET, "juliet@example.com/balcony", "example.com", "d1", "en");
        final ItemsQuery query = new ItemsQuery();
        request.addPayload(query);
        final Error error = Error.of(503, Error.Type.CANCEL, Condition.SERVICE_UNAVAILABLE, null);

        final Iq response = request.makeErrorResponse(error);

        Assert.assertNotSame(request, response);
        Assert.assertEquals(request.getTo(), response.getFrom());
        Assert.assertEquals(request.getFrom(), response.getTo());
        Assert.assertEquals(Iq.Type.ERROR, response.getType());
        Assert.assertEquals("d1", response.getId());
        Assert.assertEquals("en", response.getLang());
        Assert.assertSame(error, response.getError());
        Assert.assertEquals(request.getPayloads(), response.getPayloads());
        Assert.assertSame(query, response.getPayloads().get(0));

        Assert.assertEquals(Iq.Type.GET, request.getType());
        Assert.assertNull(request.getError());
        Assert.assertEquals("juliet@example.com/balcony", request.getFrom());

        Assert.assertEquals(
                "<iq id=\"d1\" type=\"error\" from=\"example.com\""
                        + " to=\"juliet@example.com/balcony\" xml:lang=\"en\">"
                        + "<query xmlns=\"http://jabber.org/protocol/disco#items\"/>"
                        + "<error code=\"503\" type=\"cancel\">"
                        + "<service-unavailable xmlns=\"urn:ietf:params:xml:ns:xmpp-stanzas\"/>"
                        + "</error></iq>",
                response.toString());
    }

    @Test
    public void errorWithoutCodeIsNotEncoded() {
        final Iq request = new Iq(Iq.Type.SET, "a@example.com", "b@example.com", "z", null);
        final Iq response = request.makeErrorResponse(new Error(0, "cancel", "gone", null));
        Assert.assertEquals(
                "<iq id=\"z\" type=\"error\" from=\"b@example.com\" to=\"a@example.com\"/>",
                response.toString());
    }

    @Test
    public void errorResponseRoundTrip() throws IOException {
        final Iq request = new Iq(Iq.Type.GET, "a@example.com/r", "example.com", "r1", null);
        final Error error = new Error(404, "cancel", "item-not-found", "no such node");
        final Iq decoded = XmlElementReader.readIq(request.makeErrorResponse(error).toString());
        Assert.assertEquals(Iq.Type.ERROR, decoded.getType());
        Assert.assertEquals(error, decoded.getError());
        Assert.assertEquals("example.com", decoded.getFrom());
        Assert.assertEquals("a@example.com/r", decoded.getTo());
    }
}
