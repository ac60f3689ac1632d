package io.patchbay.core.harness;

import java.io.Serial;

/// Failure raised by a simulated delegation operation.
public class MockDelegationException extends RuntimeException {

    @Serial private static final long serialVersionUID = 8123905587713045121L;

    public MockDelegationException(String message) {
        super(message);
    }
}
