package com.aiops.dataCollector.identity;

/**
 * Utility class for masking account numbers in logs.
 */
public class AccountIdMasker {

    /**
     * Shows the last 2 digits only (e.g. "****42").
     *
     * @param accountId The account number to mask, may be null
     * @return Masked account number
     */
    public static String mask(Integer accountId) {
        if (accountId == null) {
            return "****";
        }
        String value = accountId.toString();
        if (value.length() <= 2) {
            return "****" + value;
        }
        return "****" + value.substring(value.length() - 2);
    }
}
