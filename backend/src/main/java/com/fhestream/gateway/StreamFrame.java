package com.fhestream.gateway;

/**
 * One unit written to a subscriber. EVENT frames carry the message id and JSON; KEEP_ALIVE frames are comments.
 */
public record StreamFrame(Kind kind, String eventId, String data) {

    public enum Kind {
        CONNECTED,
        EVENT,
        KEEP_ALIVE,
        ERROR
    }

    public static StreamFrame event(String eventId, String json) {
        return new StreamFrame(Kind.EVENT, eventId, json);
    }

    public static StreamFrame connected(String json) {
        return new StreamFrame(Kind.CONNECTED, null, json);
    }

    public static StreamFrame keepAlive() {
        return new StreamFrame(Kind.KEEP_ALIVE, null, "keep-alive");
    }

    public static StreamFrame error(String json) {
        return new StreamFrame(Kind.ERROR, null, json);
    }
}
