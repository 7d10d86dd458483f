package com.axlabs.neo.sharesgov;

/**
 * Thrown when a governance operation is rejected. The message has the form {@code [SharesGov.<method>] <reason>}.
 */
public class GovernanceException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ErrorKind kind;
    private final String method;

    public GovernanceException(ErrorKind kind, String method, String reason) {
        super("[SharesGov." + method + "] " + reason);
        this.kind = kind;
        this.method = method;
    }

    public GovernanceException(ErrorKind kind, String method) {
        this(kind, method, kind.getDefaultMessage());
    }

    public ErrorKind getKind() {
        return kind;
    }

    /**
     * @return the name of the engine operation that rejected the call.
     */
    public String getMethod() {
        return method;
    }
}
