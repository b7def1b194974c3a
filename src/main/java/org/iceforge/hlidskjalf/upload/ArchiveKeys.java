package org.iceforge.hlidskjalf.upload;

import org.iceforge.hlidskjalf.tile.OpticalGridTile;

/** Key helpers for the EWoC archives. */
public final class ArchiveKeys {
    private ArchiveKeys() {}

    /** "31TCJ" becomes "31/TC/J". */
    public static String tilePath(OpticalGridTile tile) {
        return tile.zonePathComponent() + "/" + tile.band() + tile.column() + "/" + tile.row();
    }

    /** Joins key segments with single slashes, dropping empty ones. */
    public static String join(String... segments) {
        StringBuilder sb = new StringBuilder();
        for (String s : segments) {
            if (s == null) continue;
            String t = s.replaceAll("^/+|/+$", "");
            if (t.isEmpty()) continue;
            if (sb.length() > 0) sb.append('/');
            sb.append(t);
        }
        return sb.toString();
    }
}
