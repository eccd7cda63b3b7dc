package info.isaksson.erland.xdlc.render;

import java.util.Locale;
import java.util.UUID;

/** Interface identifier as the eleven hex arguments of the uuid helper macros (8-4-4 then eight bytes). */
public final class UuidLiteral {

    private UuidLiteral() {}

    public static String arguments(UUID uuid) {
        String hex = uuid.toString().replace("-", "").toUpperCase(Locale.ROOT);
        StringBuilder sb = new StringBuilder();
        sb.append("0x").append(hex, 0, 8).append(',');
        sb.append("0x").append(hex, 8, 12).append(',');
        sb.append("0x").append(hex, 12, 16);
        for (int i = 16; i < 32; i += 2) {
            sb.append(",0x").append(hex, i, i + 2);
        }
        return sb.toString();
    }
}
