package de.bsommerfeld.sysml.sql.api;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Parser for RFC 8288 {@code Link} headers.
 *
 * <pre>
 * Link: &lt;https://host/elements?page[after]=x&gt;; rel="next", &lt;/elements&gt;; rel="first"
 * </pre>
 *
 * Several header lines are treated as one comma separated list. A link with
 * several relation types ({@code rel="next last"}) is registered under each.
 * The first link of a relation type wins.
 */
public final class LinkHeader {

    private static final String SEPARATORS = "()<>@,;:\\\"/[]?={}";
    private static final String UNSAFE = "[]{}|\\^` \"";

    private LinkHeader() {
    }

    /**
     * @param values header values in received order
     * @param base   URI relative targets are resolved against
     * @return target URI by relation type (lower case)
     * @throws IllegalArgumentException if a value is not a valid link list
     */
    public static Map<String, URI> parse(List<String> values, URI base) {
        Map<String, URI> links = new LinkedHashMap<>();
        for (String value : values) {
            parseValue(value, base, links);
        }
        return links;
    }

    private static void parseValue(String value, URI base, Map<String, URI> links) {
        int pos = 0;
        int length = value.length();
        while (pos < length) {
            pos = skipWhitespaceAndCommas(value, pos);
            if (pos >= length) {
                break;
            }
            if (value.charAt(pos) != '<') {
                throw new IllegalArgumentException("Expected '<' at offset " + pos + " in link header: " + value);
            }
            int close = value.indexOf('>', pos);
            if (close < 0) {
                throw new IllegalArgumentException("Unterminated link target in link header: " + value);
            }
            URI target = resolve(base, value.substring(pos + 1, close).trim());
            pos = close + 1;

            String rel = null;
            while (true) {
                pos = skipWhitespace(value, pos);
                if (pos >= length || value.charAt(pos) == ',') {
                    break;
                }
                if (value.charAt(pos) != ';') {
                    throw new IllegalArgumentException("Expected ';' at offset " + pos + " in link header: " + value);
                }
                pos = skipWhitespace(value, pos + 1);
                int nameStart = pos;
                while (pos < length && isTokenChar(value.charAt(pos))) {
                    pos++;
                }
                String name = value.substring(nameStart, pos).toLowerCase(Locale.ROOT);
                if (name.isEmpty()) {
                    throw new IllegalArgumentException("Missing parameter name in link header: " + value);
                }
                pos = skipWhitespace(value, pos);
                String paramValue = "";
                if (pos < length && value.charAt(pos) == '=') {
                    pos = skipWhitespace(value, pos + 1);
                    if (pos < length && value.charAt(pos) == '"') {
                        StringBuilder quoted = new StringBuilder();
                        pos++;
                        while (pos < length && value.charAt(pos) != '"') {
                            if (value.charAt(pos) == '\\' && pos + 1 < length) {
                                pos++;
                            }
                            quoted.append(value.charAt(pos++));
                        }
                        if (pos >= length) {
                            throw new IllegalArgumentException("Unterminated quoted string in link header: " + value);
                        }
                        pos++;
                        paramValue = quoted.toString();
                    } else {
                        int valueStart = pos;
                        while (pos < length && isTokenChar(value.charAt(pos))) {
                            pos++;
                        }
                        paramValue = value.substring(valueStart, pos);
                    }
                }
                if (name.equals("rel") && rel == null) {
                    rel = paramValue;
                }
            }
            if (rel != null) {
                for (String type : rel.trim().split("\\s+")) {
                    if (!type.isEmpty()) {
                        links.putIfAbsent(type.toLowerCase(Locale.ROOT), target);
                    }
                }
            }
        }
    }

    private static URI resolve(URI base, String reference) {
        try {
            URI target = toUri(reference);
            return base == null ? target : base.resolve(target);
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid link target '" + reference + "'", e);
        }
    }

    /**
     * Parses a URI, percent-encoding characters {@link URI} rejects outside
     * the authority. Servers send {@code page[after]=...} unencoded.
     */
    static URI toUri(String reference) throws URISyntaxException {
        try {
            return new URI(reference);
        } catch (URISyntaxException e) {
            int start = authorityEnd(reference);
            StringBuilder encoded = new StringBuilder(reference.substring(0, start));
            for (int i = start; i < reference.length(); i++) {
                char c = reference.charAt(i);
                if (UNSAFE.indexOf(c) >= 0) {
                    encoded.append('%').append(String.format("%02X", (int) c));
                } else {
                    encoded.append(c);
                }
            }
            return new URI(encoded.toString());
        }
    }

    private static int authorityEnd(String reference) {
        int slashes = reference.indexOf("//");
        if (slashes < 0) {
            return 0;
        }
        int end = slashes + 2;
        while (end < reference.length() && "/?#".indexOf(reference.charAt(end)) < 0) {
            end++;
        }
        return end;
    }

    private static boolean isTokenChar(char c) {
        return c > 32 && c < 127 && SEPARATORS.indexOf(c) < 0;
    }

    private static int skipWhitespace(String value, int pos) {
        while (pos < value.length() && Character.isWhitespace(value.charAt(pos))) {
            pos++;
        }
        return pos;
    }

    private static int skipWhitespaceAndCommas(String value, int pos) {
        while (pos < value.length() && (Character.isWhitespace(value.charAt(pos)) || value.charAt(pos) == ',')) {
            pos++;
        }
        return pos;
    }
}
