package com.jreinhal.knowledge.model;

public enum QueryIntent {
    QUERY,
    INGEST
}
