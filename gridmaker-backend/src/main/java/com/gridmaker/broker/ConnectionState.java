package com.gridmaker.broker;

/**
 * Streaming session states. Any transport error or close returns to DISCONNECTED.
 */
public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    AUTHENTICATING,
    SUBSCRIBED,
    LIVE
}
