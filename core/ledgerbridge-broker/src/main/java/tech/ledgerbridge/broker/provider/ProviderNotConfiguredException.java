package tech.ledgerbridge.broker.provider;

/**
 * Required third-party OAuth settings are missing.
 */
public class ProviderNotConfiguredException extends RuntimeException {

    public ProviderNotConfiguredException(String setting) {
        super("Third-party OAuth setting is not configured: ledgerbridge.broker.provider." + setting);
    }
}
