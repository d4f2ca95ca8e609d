package com.mocha.supporters.sync.ledger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.mocha.supporters.config.SupportersProperties;
import com.mocha.supporters.sync.http.SyncHttpClient;
import com.mocha.supporters.sync.model.DonationRecord;
import com.mocha.supporters.sync.model.HttpFetchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads every order of a ledger account, page by page, oldest page first.
 * <p>
 * A page shorter than the page size ends the loop, so an account whose order count is an
 * exact multiple of the page size costs one extra round that comes back empty.
 */
@Service
public class LedgerPageFetcher {
    private static final Logger log = LoggerFactory.getLogger(LedgerPageFetcher.class);
    private static final String JSON_ACCEPT = "application/json";

    private final SyncHttpClient httpClient;
    private final SupportersProperties properties;
    private final ObjectMapper objectMapper;

    public LedgerPageFetcher(SyncHttpClient httpClient, SupportersProperties properties, ObjectMapper objectMapper) {
        this.httpClient = httpClient;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    public List<DonationRecord> fetchAll() {
        return fetchAll(properties.getLedger().getDefaultSlug());
    }

    public List<DonationRecord> fetchAll(String slug) {
        String accountSlug = SupportersProperties.normalizeSlug(slug);
        int pageSize = properties.getLedger().getPageSize();
        List<DonationRecord> records = new ArrayList<>();
        int offset = 0;
        while (true) {
            JsonNode nodes = fetchPage(accountSlug, pageSize, offset);
            for (JsonNode node : nodes) {
                records.add(toRecord(node));
            }
            offset += pageSize;
            if (nodes.size() < pageSize) {
                log.info("Retrieved {} orders for {}", records.size(), accountSlug);
                return records;
            }
            log.debug("Loading page {} of orders for {}...", offset / pageSize, accountSlug);
        }
    }

    JsonNode fetchPage(String slug, int limit, int offset) {
        String endpoint = properties.getLedger().getEndpoint();
        HttpFetchResult fetch = httpClient.postJson(endpoint, buildPayload(slug, limit, offset), JSON_ACCEPT);
        if (fetch.isTransportFailure()) {
            throw new LedgerTransportException(
                "Ledger request failed at offset " + offset + ": " + fetch.errorCode() + " " + fetch.errorMessage()
            );
        }
        if (!fetch.isSuccessful()) {
            throw new LedgerTransportException("Ledger responded with HTTP " + fetch.statusCode() + " at offset " + offset);
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(fetch.bodyAsString() == null ? "" : fetch.bodyAsString());
        } catch (JsonProcessingException e) {
            throw new LedgerTransportException("Ledger response at offset " + offset + " is not valid JSON", e);
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            throw new LedgerTransportException("Ledger response at offset " + offset + " is empty");
        }
        JsonNode errors = root.path("errors");
        if (errors.isArray() && errors.size() > 0) {
            throw new LedgerTransportException(
                "Ledger query failed: " + errors.get(0).path("message").asText("unknown error")
            );
        }
        JsonNode account = root.path("data").path("account");
        if (account.isMissingNode() || account.isNull()) {
            throw new LedgerTransportException("Ledger account not found: " + slug);
        }
        JsonNode nodes = account.path("orders").path("nodes");
        if (!nodes.isArray()) {
            throw new LedgerTransportException("Ledger response for " + slug + " has no order nodes");
        }
        return nodes;
    }

    String buildPayload(String slug, int limit, int offset) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("query", LedgerQueries.ACCOUNT_ORDERS);
        ObjectNode variables = payload.putObject("variables");
        variables.put("limit", limit);
        variables.put("offset", offset);
        variables.put("slug", slug);
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize ledger query", e);
        }
    }

    DonationRecord toRecord(JsonNode node) {
        JsonNode account = node.path("fromAccount");
        String slug = text(account, "slug");
        if (slug == null) {
            throw new LedgerTransportException("Ledger order without a supporter slug: " + node);
        }
        return new DonationRecord(
            text(account, "id"),
            text(account, "name"),
            slug,
            text(account, "website"),
            text(account, "imgUrlMed"),
            text(account, "imgUrlSmall"),
            text(account, "type"),
            toMinorUnits(node.path("totalDonations").path("value")),
            parseInstant(text(node, "createdAt"))
        );
    }

    static long toMinorUnits(JsonNode value) {
        if (value == null || value.isMissingNode() || value.isNull()) {
            throw new LedgerTransportException("Ledger order without a donation total");
        }
        try {
            BigDecimal major = value.isNumber() ? value.decimalValue() : new BigDecimal(value.asText("0").trim());
            return major.movePointRight(2).setScale(0, RoundingMode.HALF_UP).longValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            throw new LedgerTransportException("Unusable donation total: " + value, e);
        }
    }

    private Instant parseInstant(String value) {
        if (value == null) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            log.debug("Ignoring unparseable order timestamp {}", value);
            return null;
        }
    }

    private String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }
}
