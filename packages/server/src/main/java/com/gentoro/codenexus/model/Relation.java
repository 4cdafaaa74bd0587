package com.gentoro.codenexus.model;

/**
 * Directed relation seen from one end. For outgoing relations {@code target} is the destination
 * file; for incoming relations it holds the peer (source) file.
 */
public record Relation(String target, String description) {}
