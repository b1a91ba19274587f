package uimbt.fingerprint;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Normalizes application URLs into route patterns.
 *
 * <p>Single-page applications route through the fragment ({@code #!/admin/config}),
 * so the fragment wins over the path when present. The hash-bang {@code !},
 * surrounding slashes and the query are removed; numeric segments are kept
 * as-is. Query parameters of both the URL and the fragment become route
 * parameters.
 */
public final class UrlPatterns {

    public static final String ROOT = "root";

    private UrlPatterns() {}

    private record Parts(String path, String query, String fragmentPath, String fragmentQuery) {}

    /**
     * {@code http://host/#!/admin/config?tab=users} → {@code admin/config};
     * an empty route → {@value #ROOT}.
     */
    public static String urlPattern(String url) {
        Parts p = split(url);
        String route = trimSlashes(p.fragmentPath());
        if (route.isEmpty()) route = trimSlashes(p.path());
        return route.isEmpty() ? ROOT : route;
    }

    /**
     * Query parameters of the URL and of its fragment, URL-decoded. Parameters
     * that occur once map to a string, repeated ones to a list.
     */
    public static Map<String, Object> routeParams(String url) {
        Parts p = split(url);
        Map<String, List<String>> collected = new LinkedHashMap<>();
        collect(p.query(), collected);
        collect(p.fragmentQuery(), collected);

        Map<String, Object> out = new LinkedHashMap<>();
        collected.forEach((k, v) -> out.put(k, v.size() == 1 ? v.get(0) : List.copyOf(v)));
        return out;
    }

    /** The URL without query and fragment-query, used as a merge key. */
    public static String urlBase(String url) {
        Parts p = split(url);
        String route = trimSlashes(p.fragmentPath());
        return route.isEmpty() ? trimSlashes(p.path()) : route;
    }

    // ── Internal ──────────────────────────────────────────────────────────

    private static Parts split(String url) {
        if (url == null) return new Parts("", "", "", "");
        String s = url.strip();

        String fragment = "";
        int hash = s.indexOf('#');
        if (hash >= 0) {
            fragment = s.substring(hash + 1);
            s = s.substring(0, hash);
        }

        int scheme = s.indexOf("://");
        if (scheme >= 0) {
            String rest = s.substring(scheme + 3);
            int cut = firstOf(rest, '/', '?');
            s = cut < 0 ? "" : rest.substring(cut);
        }
        String path = s;
        String query = "";
        int q = s.indexOf('?');
        if (q >= 0) {
            path = s.substring(0, q);
            query = s.substring(q + 1);
        }

        if (fragment.startsWith("!")) fragment = fragment.substring(1);
        String fragmentPath = fragment;
        String fragmentQuery = "";
        int fq = fragment.indexOf('?');
        if (fq >= 0) {
            fragmentPath = fragment.substring(0, fq);
            fragmentQuery = fragment.substring(fq + 1);
        }
        return new Parts(path, query, fragmentPath, fragmentQuery);
    }

    private static void collect(String query, Map<String, List<String>> into) {
        if (query == null || query.isEmpty()) return;
        for (String pair : query.split("&")) {
            if (pair.isEmpty()) continue;
            int eq = pair.indexOf('=');
            String key = decode(eq < 0 ? pair : pair.substring(0, eq));
            String value = eq < 0 ? "" : decode(pair.substring(eq + 1));
            if (key.isEmpty()) continue;
            into.computeIfAbsent(key, k -> new ArrayList<>()).add(value);
        }
    }

    private static String decode(String s) {
        try {
            return URLDecoder.decode(s, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return s;
        }
    }

    private static int firstOf(String s, char a, char b) {
        int ia = s.indexOf(a);
        int ib = s.indexOf(b);
        if (ia < 0) return ib;
        if (ib < 0) return ia;
        return Math.min(ia, ib);
    }

    private static String trimSlashes(String s) {
        int start = 0;
        int end = s.length();
        while (start < end && s.charAt(start) == '/') start++;
        while (end > start && s.charAt(end - 1) == '/') end--;
        return s.substring(start, end);
    }
}
