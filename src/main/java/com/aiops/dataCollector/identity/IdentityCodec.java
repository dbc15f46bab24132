package com.aiops.dataCollector.identity;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Encodes and decodes the base64 identity blob carried in the x-rh-identity header:
 * {@code base64({"identity": {"account_number": <accountId>}})}.
 */
public class IdentityCodec {

    public static final String HEADER = "x-rh-identity";

    private static final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * Builds the identity blob for an account.
     *
     * @param accountId Account number
     * @return Base64 encoded JSON identity
     */
    public static String encode(int accountId) {
        ObjectNode root = objectMapper.createObjectNode();
        root.putObject("identity").put("account_number", accountId);
        try {
            byte[] json = objectMapper.writeValueAsBytes(root);
            return Base64.getEncoder().encodeToString(json);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to serialize identity for account " + AccountIdMasker.mask(accountId), e);
        }
    }

    /**
     * Extracts the account number from an identity blob.
     *
     * @param blob Base64 encoded JSON identity
     * @return Account number, or null when the identity carries none
     * @throws InvalidIdentityException if the blob is not base64 JSON or the account number is not numeric or does not fit an int
     */
    public static Integer decodeAccountId(String blob) {
        JsonNode identity;
        try {
            byte[] json = Base64.getDecoder().decode(blob.trim());
            identity = objectMapper.readTree(new String(json, StandardCharsets.UTF_8));
        } catch (IllegalArgumentException | IOException e) {
            throw new InvalidIdentityException("Identity header is not base64 encoded JSON", e);
        }

        if (identity == null || !identity.isObject()) {
            throw new InvalidIdentityException("Identity header does not contain a JSON object");
        }

        JsonNode accountNumber = identity.path("identity").path("account_number");
        if (accountNumber.isMissingNode() || accountNumber.isNull()) {
            return null;
        }
        if (accountNumber.isIntegralNumber()) {
            if (!accountNumber.canConvertToInt()) {
                throw new InvalidIdentityException("Account number is out of range: " + accountNumber.asText());
            }
            return accountNumber.intValue();
        }
        try {
            return Integer.valueOf(accountNumber.asText().trim());
        } catch (NumberFormatException e) {
            throw new InvalidIdentityException("Account number is not numeric: " + accountNumber.asText(), e);
        }
    }
}
