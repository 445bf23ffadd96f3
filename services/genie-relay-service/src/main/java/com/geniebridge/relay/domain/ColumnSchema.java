package com.geniebridge.relay.domain;

/** One result column: its display name and the SQL type tag reported by the warehouse. */
public record ColumnSchema(String name, String typeName) {}
