package org.iceforge.hlidskjalf.retrieval;

import org.iceforge.hlidskjalf.ErrorKind;
import org.iceforge.hlidskjalf.GatewayException;

import java.util.List;

/** Every candidate provider failed. Carries the per-provider reasons in candidate order. */
public class RetrievalExhaustedException extends GatewayException {
    private final List<RetrievalModels.ProviderFailure> failures;

    public RetrievalExhaustedException(String message, List<RetrievalModels.ProviderFailure> failures) {
        super(ErrorKind.RETRIEVAL_EXHAUSTED, message + " after " + failures.size() + " provider(s): " + failures);
        this.failures = List.copyOf(failures);
    }

    public List<RetrievalModels.ProviderFailure> failures() {
        return failures;
    }
}
