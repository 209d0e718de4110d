package com.chainwatch.attribution;

public record AttributionResult(int entityFlags, OnrampOutcome onramp) {
}
