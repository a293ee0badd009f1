/**
 * WebSocket side of the transport gateway: JSON envelopes {@code {type, payload}} in both
 * directions, validated with the same request records as the REST API.
 */
package com.phillippitts.granupose.presentation.websocket;
