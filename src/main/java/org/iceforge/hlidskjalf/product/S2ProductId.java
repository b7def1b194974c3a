package org.iceforge.hlidskjalf.product;

import org.iceforge.hlidskjalf.tile.InvalidTileIdException;
import org.iceforge.hlidskjalf.tile.OpticalGridTile;

import java.time.LocalDateTime;

/**
 * Sentinel-2 product name, e.g. {@code S2B_MSIL1C_20210714T235249_N0301_R130_T57KUR_20210715T005654}.
 */
public record S2ProductId(
        String id,
        String missionId,
        Level level,
        LocalDateTime sensingTime,
        String baseline,
        int relativeOrbit,
        OpticalGridTile tile,
        String discriminator
) {
    public enum Level { L1C, L2A }

    public static S2ProductId parse(String productId) {
        String base = ProductIds.baseName(productId);
        String[] p = base.split("_");
        if (p.length != 7) {
            throw new InvalidProductIdException("Sentinel-2 product ID must have 7 fields: " + productId);
        }
        if (!p[0].equals("S2A") && !p[0].equals("S2B")) {
            throw new InvalidProductIdException("Mission ID " + p[0] + " is not S2A or S2B");
        }
        Level level;
        if (p[1].equals("MSIL1C")) {
            level = Level.L1C;
        } else if (p[1].equals("MSIL2A")) {
            level = Level.L2A;
        } else {
            throw new InvalidProductIdException("Product level of " + p[1] + " is not L1C or L2A");
        }
        if (!p[3].matches("N\\d{4}")) {
            throw new InvalidProductIdException("Bad processing baseline " + p[3]);
        }
        if (!p[4].matches("R\\d{3}")) {
            throw new InvalidProductIdException("Bad relative orbit " + p[4]);
        }
        int orbit = Integer.parseInt(p[4].substring(1));
        if (orbit < 1 || orbit > 143) {
            throw new InvalidProductIdException("Relative orbit " + orbit + " is not in [001, 143]");
        }
        if (!p[5].startsWith("T") || p[5].length() != 6) {
            throw new InvalidProductIdException("Bad tile field " + p[5]);
        }
        OpticalGridTile tile;
        try {
            tile = OpticalGridTile.parse(p[5].substring(1));
        } catch (InvalidTileIdException e) {
            throw new InvalidProductIdException("Bad tile in " + productId, e);
        }
        if (p[6].length() != 15) {
            throw new InvalidProductIdException("Product discriminator must have 15 characters: " + p[6]);
        }
        return new S2ProductId(base, p[0], level, ProductIds.dateTime(p[2], productId),
                p[3].substring(1), orbit, tile, p[6]);
    }

    public static boolean isValid(String productId) {
        try {
            parse(productId);
            return true;
        } catch (InvalidProductIdException e) {
            return false;
        }
    }
}
