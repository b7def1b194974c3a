package org.iceforge.hlidskjalf.product;

import java.time.LocalDate;

/**
 * Landsat 8/9 Collection 2 product name: {@code LXSS_LLLL_PPPRRR_YYYYMMDD_yyyymmdd_CC_TX},
 * e.g. {@code LC08_L2SP_227099_20211017_20211026_02_T2}.
 */
public record L8ProductId(
        String id,
        String sensor,
        String processingLevel,
        String wrs2Path,
        String wrs2Row,
        LocalDate acquisitionDate,
        LocalDate processingDate,
        String collection,
        String category
) {
    public static L8ProductId parse(String productId) {
        String base = ProductIds.baseName(productId);
        String[] p = base.split("_");
        if (p.length != 7) {
            throw new InvalidProductIdException("Landsat product ID must have 7 fields: " + productId);
        }
        if (!p[0].matches("L[COTEM]0[89]")) {
            throw new InvalidProductIdException("Unsupported Landsat platform " + p[0]);
        }
        if (!p[2].matches("\\d{6}")) {
            throw new InvalidProductIdException("Bad WRS-2 path/row " + p[2]);
        }
        return new L8ProductId(base, p[0], p[1], p[2].substring(0, 3), p[2].substring(3),
                ProductIds.date(p[3], productId), ProductIds.date(p[4], productId), p[5], p[6]);
    }

    /** File name of a product item such as "SR_B4" or "QA_PIXEL". */
    public String itemFileName(String item) {
        String suffix = switch (item) {
            case "ANG" -> "ANG.txt";
            case "MTL_XML" -> "MTL.xml";
            case "MTL_TXT" -> "MTL.txt";
            case "MTL_JSON" -> "MTL.json";
            case "SR_STAC" -> "SR_stac.json";
            case "ST_STAC" -> "ST_stac.json";
            case "thumb_large", "thumb_small" -> item + ".jpeg";
            default -> item + ".TIF";
        };
        return id + "_" + suffix;
    }
}
