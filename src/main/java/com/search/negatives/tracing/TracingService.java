package com.search.negatives.tracing;

import java.util.Map;

/**
 * Starts spans around batches and units. {@link NoOpTracingService} is the default.
 */
public interface TracingService {

    /** Span covering a whole batch run. */
    String BATCH_SPAN = "negatives.batch";

    /** Span covering one unit's pipeline, on its worker thread. */
    String UNIT_SPAN = "negatives.unit";

    Span startSpan(String operationName, Map<String, String> attributes);

    default Span startSpan(String operationName) {
        return startSpan(operationName, Map.of());
    }
}
