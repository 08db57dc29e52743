package tech.ledgerbridge.broker.gate;

public class GateRejectedException extends RuntimeException {

    private final GateFailure failure;

    public GateRejectedException(GateFailure failure, String detail) {
        super(failure.name() + ": " + detail);
        this.failure = failure;
    }

    public GateRejectedException(GateFailure failure, String detail, Throwable cause) {
        super(failure.name() + ": " + detail, cause);
        this.failure = failure;
    }

    public GateFailure getFailure() {
        return failure;
    }
}
