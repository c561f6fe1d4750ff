package com.groceryshopper.chat.service.inventory;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses {@code name, stock, safety_stock} lines and upserts them into the user's inventory.
 *
 * <p>A malformed line never aborts the batch. It is reported back verbatim in the
 * confirmation text together with the number of lines that were stored.
 */
@Component
@Slf4j
public class InventoryIngestionHandler {

    static final String TEMPLATE = """
        To update your inventory, send @inventory followed by one item per line:
        name, stock, safety_stock
        Example:
        @inventory
        Tomatoes, 50, 20
        Cheese, 10, 5""";

    static final String NO_VALID_LINES = "No valid inventory lines found. Use: name, stock, safety_stock";

    private final InventoryService inventoryService;

    public InventoryIngestionHandler(InventoryService inventoryService) {
        this.inventoryService = inventoryService;
    }

    /**
     * @param body message text with the trigger already removed
     * @return the confirmation (or template) text to post back to the room
     */
    public String ingest(Long userId, String body) {
        if (body == null || body.isBlank()) {
            return TEMPLATE;
        }

        int stored = 0;
        List<String> malformed = new ArrayList<>();
        for (String rawLine : body.split("\\r?\\n")) {
            String line = rawLine.trim();
            if (line.isEmpty()) {
                continue;
            }
            ParsedLine parsed = parse(line);
            if (parsed == null) {
                malformed.add(line);
                continue;
            }
            inventoryService.upsert(userId, parsed.name, parsed.stock, parsed.safetyStock);
            stored++;
        }

        log.info("Inventory ingestion: userId={}, stored={}, malformed={}", userId, stored, malformed.size());
        return confirmation(stored, malformed);
    }

    static ParsedLine parse(String line) {
        String[] fields = line.split(",", -1);
        if (fields.length != 3) {
            return null;
        }
        String name = fields[0].trim();
        if (name.isEmpty()) {
            return null;
        }
        try {
            int stock = Integer.parseInt(fields[1].trim());
            int safety = Integer.parseInt(fields[2].trim());
            if (stock < 0 || safety < 0) {
                return null;
            }
            return new ParsedLine(name, stock, safety);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private String confirmation(int stored, List<String> malformed) {
        if (stored == 0 && malformed.isEmpty()) {
            return NO_VALID_LINES;
        }
        StringBuilder reply = new StringBuilder();
        if (stored > 0) {
            reply.append("Updated ").append(stored).append(stored == 1 ? " inventory item." : " inventory items.");
        }
        if (!malformed.isEmpty()) {
            if (reply.length() > 0) {
                reply.append("\n");
            }
            reply.append("Could not parse these lines (expected: name, stock, safety_stock):");
            for (String line : malformed) {
                reply.append("\n").append(line);
            }
        }
        return reply.toString();
    }

    static final class ParsedLine {
        final String name;
        final int stock;
        final int safetyStock;

        ParsedLine(String name, int stock, int safetyStock) {
            this.name = name;
            this.stock = stock;
            this.safetyStock = safetyStock;
        }
    }
}
