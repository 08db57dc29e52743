package tech.ledgerbridge.broker.gate;

public class MethodNotFoundException extends Exception {

    public MethodNotFoundException(String method) {
        super("Method not found: " + method);
    }
}
