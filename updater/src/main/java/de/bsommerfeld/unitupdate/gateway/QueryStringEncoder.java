package de.bsommerfeld.unitupdate.gateway;

import java.lang.reflect.Array;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Encodes request parameters as an {@code application/x-www-form-urlencoded}
 * string. The output doubles as the canonical form for request signatures,
 * so it has to be byte-for-byte stable:
 * <ul>
 * <li>entries keep the iteration order of the map</li>
 * <li>lists and arrays become {@code key[0]=a&key[1]=b}, nested maps
 * {@code key[sub]=v}</li>
 * <li>{@code null} values are omitted, booleans are {@code 1} or {@code 0}</li>
 * </ul>
 */
public final class QueryStringEncoder {

    private QueryStringEncoder() {
    }

    public static String encode(Map<String, ?> params) {
        StringJoiner out = new StringJoiner("&");
        params.forEach((key, value) -> append(out, key, value));
        return out.toString();
    }

    private static void append(StringJoiner out, String key, Object value) {
        if (value == null)
            return;

        if (value instanceof Map<?, ?> map) {
            map.forEach((k, v) -> append(out, key + "[" + k + "]", v));
        } else if (value instanceof Iterable<?> iterable) {
            int index = 0;
            for (Object element : iterable) {
                append(out, key + "[" + index++ + "]", element);
            }
        } else if (value.getClass().isArray()) {
            for (int i = 0; i < Array.getLength(value); i++) {
                append(out, key + "[" + i + "]", Array.get(value, i));
            }
        } else if (value instanceof Boolean bool) {
            out.add(urlEncode(key) + "=" + (bool ? "1" : "0"));
        } else {
            out.add(urlEncode(key) + "=" + urlEncode(value.toString()));
        }
    }

    private static String urlEncode(String s) {
        // URLEncoder leaves "*" alone, the gateway canonicalizes it as %2A
        return URLEncoder.encode(s, StandardCharsets.UTF_8).replace("*", "%2A");
    }
}
