package com.invoicebot.common.dto;

/**
 * Reference to an object in the store: its opaque id and a shareable link.
 */
public record StoredItem(String id, String webUrl) {
}
