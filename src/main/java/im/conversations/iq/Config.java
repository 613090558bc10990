package im.conversations.iq;

public final class Config {

    public static final String LOGTAG = "iq-codec";

    private Config() {}
}
