package com.dragnet.core.pipeline;

import java.util.List;

/** A pipeline item together with the path it took. */
public record Envelope<T>(T value, List<ProvenanceEntry> provenance) {

    public Envelope {
        provenance = List.copyOf(provenance);
    }
}
