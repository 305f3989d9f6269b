package com.fhestream.gateway;

/**
 * Validated connection parameters. lastEventId and sinceSlot both request a gap fill.
 */
public record StreamRequest(StreamChannel channel, String principal, String lastEventId, Long sinceSlot) {

    public StreamRequest {
        if (channel == StreamChannel.USER && (principal == null || principal.isBlank())) {
            throw new StreamRequestException("MISSING_PRINCIPAL", "principal is required for the user channel");
        }
        if (sinceSlot != null && sinceSlot < 0) {
            throw new StreamRequestException("INVALID_SINCE_SLOT", "sinceSlot must be a non-negative integer");
        }
        if (lastEventId != null && lastEventId.isBlank()) {
            lastEventId = null;
        }
    }

    /**
     * Builds a request from raw query values; the header value is used when the query has no lastEventId.
     */
    public static StreamRequest of(String channel, String principal, String lastEventId, String lastEventIdHeader, String sinceSlot) {
        String resumeFrom = lastEventId != null && !lastEventId.isBlank() ? lastEventId : lastEventIdHeader;
        return new StreamRequest(StreamChannel.parse(channel), blankToNull(principal), resumeFrom, parseSlot(sinceSlot));
    }

    public boolean wantsGapFill() {
        return lastEventId != null || sinceSlot != null;
    }

    private static Long parseSlot(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new StreamRequestException("INVALID_SINCE_SLOT", "sinceSlot must be a non-negative integer");
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
