package com.fhestream.domain.message;

/**
 * Named publish-bus channel: {@code channel:global} or {@code channel:user:<principal>}.
 */
public record BusChannel(String name, String principal) {

    public static final String GLOBAL_NAME = "channel:global";
    private static final String USER_PREFIX = "channel:user:";

    private static final BusChannel GLOBAL = new BusChannel(GLOBAL_NAME, null);

    public BusChannel {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("channel name is required");
        }
    }

    public static BusChannel global() {
        return GLOBAL;
    }

    public static BusChannel user(String principal) {
        if (principal == null || principal.isBlank()) {
            throw new IllegalArgumentException("user channel needs a principal");
        }
        return new BusChannel(USER_PREFIX + principal, principal);
    }

    public boolean isUser() {
        return principal != null;
    }
}
