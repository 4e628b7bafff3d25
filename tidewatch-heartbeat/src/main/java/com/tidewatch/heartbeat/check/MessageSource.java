package com.tidewatch.heartbeat.check;

import java.util.List;
import java.util.Map;

/**
 * Where new chat messages come from.
 */
public interface MessageSource {

    /** Display name used in status lines, for example "Matrix". */
    String name();

    /**
     * Messages from roughly the last {@code sinceMinutes} minutes, grouped by
     * source id. Items may overlap earlier fetches; deduplication is the
     * caller's job.
     *
     * @throws MessageSourceException if the source could not be read
     */
    Map<String, List<InboundMessage>> fetch(int sinceMinutes) throws MessageSourceException;

    /** Cheap reachability probe used after a failed fetch. */
    boolean ping();
}
