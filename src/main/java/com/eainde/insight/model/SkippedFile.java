package com.eainde.insight.model;

public record SkippedFile(String fileName, SkipReason reason, String detail) {
}
