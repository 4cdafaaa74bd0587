package com.gentoro.codenexus.model;

/** A relation found by description search, together with the file it starts from. */
public record RelationMatch(String source, Relation relation) {}
