package com.stellar.gateway.compliance;

/**
 * Redacts key material and envelopes so they are safe to include in logs.
 * Never log a secret seed in plain text; use these masks when logging requests or results.
 */
public final class SecretMasker {

    private static final String MASKED_SECRET = "S***";
    private static final int ENVELOPE_PREFIX = 12;

    private SecretMasker() {}

    /** Returns a safe-to-log value for a secret seed (e.g. "SABC...XYZ" -> "S***"). */
    public static String maskSecret(String secret) {
        if (secret == null || secret.isBlank()) return null;
        return MASKED_SECRET;
    }

    /** Returns a shortened account id (e.g. "GABCD...WXYZ"); account ids are public but long. */
    public static String abbreviateAccount(String accountId) {
        if (accountId == null || accountId.length() <= 10) return accountId;
        return accountId.substring(0, 5) + "..." + accountId.substring(accountId.length() - 4);
    }

    /** Returns the first characters of an envelope plus its length. */
    public static String abbreviateEnvelope(String xdr) {
        if (xdr == null || xdr.isBlank()) return null;
        if (xdr.length() <= ENVELOPE_PREFIX) return xdr;
        return xdr.substring(0, ENVELOPE_PREFIX) + "...(" + xdr.length() + " chars)";
    }
}
