package com.mocha.supporters.sync;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.math.BigDecimal;

/**
 * Builds ledger GraphQL responses shaped like the donation service's {@code orders} query.
 */
public final class LedgerFixtures {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private LedgerFixtures() {
    }

    public static ArrayNode nodes() {
        return MAPPER.createArrayNode();
    }

    public static ObjectNode order(String slug, String name, String type, String total, String avatarBase) {
        ObjectNode node = MAPPER.createObjectNode();
        ObjectNode account = node.putObject("fromAccount");
        account.put("id", "id-" + slug);
        account.put("name", name);
        account.put("slug", slug);
        account.put("website", "https://" + slug + ".example");
        account.put("imgUrlMed", avatarBase + "/" + slug + "/64.png");
        account.put("imgUrlSmall", avatarBase + "/" + slug + "/32.png");
        account.put("type", type);
        node.putObject("totalDonations").put("value", new BigDecimal(total));
        node.put("createdAt", "2019-05-01T10:00:00Z");
        return node;
    }

    public static ArrayNode filler(int count, String avatarBase) {
        ArrayNode nodes = nodes();
        for (int i = 0; i < count; i++) {
            nodes.add(order("filler-" + i, "Filler " + i, "INDIVIDUAL", "1", avatarBase));
        }
        return nodes;
    }

    public static String page(ArrayNode nodes, int limit, int offset) {
        ObjectNode root = MAPPER.createObjectNode();
        ObjectNode orders = root.putObject("data").putObject("account").putObject("orders");
        orders.put("limit", limit);
        orders.put("offset", offset);
        orders.put("totalCount", nodes.size());
        orders.set("nodes", nodes);
        return root.toString();
    }
}
