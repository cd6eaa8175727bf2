package com.talent.match.processors;

import java.util.concurrent.CompletableFuture;

public interface PayloadProcessor {
    CompletableFuture<Void> process(String payload);
}
