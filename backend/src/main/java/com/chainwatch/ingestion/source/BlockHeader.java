package com.chainwatch.ingestion.source;

public record BlockHeader(long number, String hash, String parentHash) {
}
