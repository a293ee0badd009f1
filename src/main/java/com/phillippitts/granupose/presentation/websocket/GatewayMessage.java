package com.phillippitts.granupose.presentation.websocket;

import java.util.Arrays;
import java.util.Optional;

/**
 * Decoded and validated inbound WebSocket frame.
 *
 * @param type frame type
 * @param payload validated payload DTO; {@code null} for {@link Type#PING}
 */
record GatewayMessage(Type type, Object payload) {

    enum Type {
        PING("ping"),
        CHANNEL_SET("channel:set"),
        CHANNELS_SET("channels:set"),
        OSC_SEND("osc:send"),
        OSC_BATCH("osc:batch");

        private final String wireName;

        Type(String wireName) {
            this.wireName = wireName;
        }

        String wireName() {
            return wireName;
        }

        static Optional<Type> fromWire(String wireName) {
            return Arrays.stream(values()).filter(t -> t.wireName.equals(wireName)).findFirst();
        }
    }

    <T> T payloadAs(Class<T> type) {
        return type.cast(payload);
    }
}
