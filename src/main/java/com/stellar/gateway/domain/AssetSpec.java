package com.stellar.gateway.domain;

/**
 * Asset selection rules shared by payments and trustlines.
 */
public final class AssetSpec {

    /** Code of the ledger's base currency. Never needs an issuer. */
    public static final String NATIVE_CODE = "XLM";

    private AssetSpec() {}

    public static boolean isNative(String assetCode) {
        return assetCode == null || NATIVE_CODE.equals(assetCode);
    }
}
