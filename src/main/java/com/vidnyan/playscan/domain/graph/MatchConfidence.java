package com.vidnyan.playscan.domain.graph;

/**
 * How a notification was matched to a handler.
 */
public enum MatchConfidence {
    NAME,       // notify text equals the handler name
    TOPIC,      // notify text equals a listen topic
    AMBIGUOUS   // several handlers share the name
}
