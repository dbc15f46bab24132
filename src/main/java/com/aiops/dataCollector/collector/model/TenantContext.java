package com.aiops.dataCollector.collector.model;

import com.aiops.dataCollector.identity.IdentityCodec;

import java.util.Map;

/**
 * Account-scoped identity under which data is collected and forwarded.
 * The anonymous context has neither account nor identity and adds no header.
 *
 * @param accountId Account number, null when anonymous
 * @param identityBlob Base64 identity sent as x-rh-identity, null when anonymous
 */
public record TenantContext(Integer accountId, String identityBlob) {

    private static final TenantContext ANONYMOUS = new TenantContext(null, null);

    public static TenantContext forAccount(int accountId) {
        return new TenantContext(accountId, IdentityCodec.encode(accountId));
    }

    public static TenantContext anonymous() {
        return ANONYMOUS;
    }

    public boolean isAnonymous() {
        return accountId == null && identityBlob == null;
    }

    /**
     * Request headers carrying this identity; empty when there is none.
     */
    public Map<String, String> headers() {
        return identityBlob == null ? Map.of() : Map.of(IdentityCodec.HEADER, identityBlob);
    }
}
