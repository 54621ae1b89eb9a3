package io.meshward.net;

public record ExchangeOutcome(int sent, int sendFailures, int received, int dispatched, int malformed) {
}
