package org.iceforge.hlidskjalf.product;

import org.iceforge.hlidskjalf.provider.DataKind;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/**
 * Parsers for the product identifiers the gateway can retrieve by ID.
 */
public final class ProductIds {

    static final DateTimeFormatter DATETIME = DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss", Locale.ROOT);
    static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("yyyyMMdd", Locale.ROOT);

    private ProductIds() {}

    /** Strips a trailing ".SAFE" (or any extension) from a product ID. */
    public static String baseName(String productId) {
        String s = productId.trim();
        int dot = s.indexOf('.');
        return dot < 0 ? s : s.substring(0, dot);
    }

    public static DataKind detectKind(String productId) {
        if (productId == null || productId.isBlank()) {
            throw new InvalidProductIdException("Product ID is blank");
        }
        String base = baseName(productId);
        if (base.startsWith("S1")) {
            S1ProductId.parse(productId);
            return DataKind.SENTINEL1;
        }
        if (base.startsWith("S2")) {
            return S2ProductId.parse(productId).level() == S2ProductId.Level.L1C
                    ? DataKind.SENTINEL2_L1C : DataKind.SENTINEL2_L2A;
        }
        if (base.startsWith("LC08") || base.startsWith("LC09")) {
            L8ProductId.parse(productId);
            return DataKind.LANDSAT8;
        }
        throw new InvalidProductIdException("Unrecognized product ID: " + productId);
    }

    /** Acquisition date carried by any supported product ID. */
    public static LocalDate acquisitionDate(String productId) {
        return switch (detectKind(productId)) {
            case SENTINEL1 -> S1ProductId.parse(productId).startTime().toLocalDate();
            case SENTINEL2_L1C, SENTINEL2_L2A -> S2ProductId.parse(productId).sensingTime().toLocalDate();
            case LANDSAT8 -> L8ProductId.parse(productId).acquisitionDate();
            default -> throw new InvalidProductIdException("No acquisition date in " + productId);
        };
    }

    static LocalDateTime dateTime(String value, String productId) {
        try {
            return LocalDateTime.parse(value, DATETIME);
        } catch (DateTimeParseException e) {
            throw new InvalidProductIdException("Bad timestamp '" + value + "' in " + productId, e);
        }
    }

    static LocalDate date(String value, String productId) {
        try {
            return LocalDate.parse(value, DATE);
        } catch (DateTimeParseException e) {
            throw new InvalidProductIdException("Bad date '" + value + "' in " + productId, e);
        }
    }
}
