package com.eainde.insight.schema;

public enum MappingOrigin {
    ORACLE,
    HEURISTIC
}
