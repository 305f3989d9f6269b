package com.fhestream.domain;

public record InputHandleRegistered(String signature, long slot, Long blockTime, String caller,
                                    Handle handle, String clientTag) implements IndexedEvent {

    @Override
    public EventKind kind() {
        return EventKind.INPUT_HANDLE_REGISTERED;
    }
}
