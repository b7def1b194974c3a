package org.iceforge.hlidskjalf.product;

import java.time.LocalDateTime;
import java.util.Set;

/**
 * Sentinel-1 product name, e.g. {@code S1A_IW_GRDH_1SDV_20210708T060105_20210708T060130_038682_04908E_8979}.
 */
public record S1ProductId(
        String id,
        String missionId,
        String beamMode,
        String productType,
        char resolutionClass,
        char processingLevel,
        char productClass,
        String polarisation,
        LocalDateTime startTime,
        LocalDateTime stopTime,
        String absoluteOrbit,
        String datatakeId,
        String uniqueId
) {
    private static final Set<String> POLARISATIONS = Set.of("SH", "SV", "DH", "DV");

    public static S1ProductId parse(String productId) {
        String base = ProductIds.baseName(productId);
        String[] p = base.split("_");
        if (p.length != 9) {
            throw new InvalidProductIdException("Sentinel-1 product ID must have 9 fields: " + productId);
        }
        if (!p[0].matches("S1[A-D]")) {
            throw new InvalidProductIdException("Unknown Sentinel-1 mission " + p[0]);
        }
        if (p[2].length() != 4 || "FHM".indexOf(p[2].charAt(3)) < 0) {
            throw new InvalidProductIdException("Bad product type/resolution '" + p[2] + "' in " + productId);
        }
        if (p[3].length() != 4 || "12".indexOf(p[3].charAt(0)) < 0 || "SA".indexOf(p[3].charAt(1)) < 0) {
            throw new InvalidProductIdException("Bad level/class '" + p[3] + "' in " + productId);
        }
        String pol = p[3].substring(2);
        if (!POLARISATIONS.contains(pol)) {
            throw new InvalidProductIdException("Polarisation " + pol + " is not one of " + POLARISATIONS);
        }
        if (p[6].length() != 6 || p[7].length() != 6 || p[8].length() != 4) {
            throw new InvalidProductIdException("Bad orbit/datatake/unique id lengths in " + productId);
        }
        return new S1ProductId(base, p[0], p[1], p[2].substring(0, 3), p[2].charAt(3),
                p[3].charAt(0), p[3].charAt(1), pol,
                ProductIds.dateTime(p[4], productId), ProductIds.dateTime(p[5], productId),
                p[6], p[7], p[8]);
    }
}
