package im.conversations.iq.xmpp.model.iot;

import im.conversations.iq.xml.Namespace;
import im.conversations.iq.xmpp.model.Extension;

public class ControlSetResponse extends Extension {

    public static final String NAME = "setResponse";

    public ControlSetResponse() {
        super(NAME, Namespace.IOT_CONTROL);
    }
}
