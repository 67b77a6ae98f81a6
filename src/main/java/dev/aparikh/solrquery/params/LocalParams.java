package dev.aparikh.solrquery.params;

import org.jspecify.annotations.Nullable;

import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Solr local-params expression: {@code {!type key=value key=value}body}.
 *
 * <p>Used by the dense vector and spatial parsers to embed a whole query into a single
 * {@code q} value, e.g. {@code {!knn f=vector topK=10}[0.1,0.2,0.3]}. Keys may repeat
 * ({@code preFilter=a preFilter=b}). Values containing whitespace, quotes or braces are
 * single-quoted with backslash escapes.</p>
 */
public final class LocalParams {

    private final String type;
    private final List<Map.Entry<String, String>> params;
    private final String body;

    private LocalParams(String type, List<Map.Entry<String, String>> params, String body) {
        this.type = type;
        this.params = List.copyOf(params);
        this.body = body;
    }

    public static Builder builder(String type) {
        return new Builder(ParamChecks.requireText(type, "Local params type"));
    }

    public String type() {
        return type;
    }

    public String body() {
        return body;
    }

    public List<Map.Entry<String, String>> params() {
        return params;
    }

    /**
     * First value of the key, or null when absent.
     */
    public @Nullable String value(String key) {
        for (Map.Entry<String, String> entry : params) {
            if (entry.getKey().equals(key)) {
                return entry.getValue();
            }
        }
        return null;
    }

    public List<String> values(String key) {
        List<String> result = new ArrayList<>();
        for (Map.Entry<String, String> entry : params) {
            if (entry.getKey().equals(key)) {
                result.add(entry.getValue());
            }
        }
        return result;
    }

    public String render() {
        StringBuilder sb = new StringBuilder("{!").append(type);
        for (Map.Entry<String, String> entry : params) {
            sb.append(' ').append(entry.getKey()).append('=').append(quote(entry.getValue()));
        }
        return sb.append('}').append(body).toString();
    }

    @Override
    public String toString() {
        return render();
    }

    /**
     * Parses a rendered expression back into its parts.
     *
     * @param text an expression starting with {@code {!}
     * @return the parsed local params
     * @throws IllegalArgumentException if the text is not a local-params expression
     */
    public static LocalParams parse(String text) {
        if (!text.startsWith("{!")) {
            throw new IllegalArgumentException("Local params must start with '{!': " + text);
        }
        int pos = 2;
        int length = text.length();
        int typeStart = pos;
        while (pos < length && !Character.isWhitespace(text.charAt(pos)) && text.charAt(pos) != '}') {
            pos++;
        }
        String type = text.substring(typeStart, pos);
        List<Map.Entry<String, String>> params = new ArrayList<>();

        while (true) {
            while (pos < length && Character.isWhitespace(text.charAt(pos))) {
                pos++;
            }
            if (pos >= length) {
                throw new IllegalArgumentException("Unterminated local params: " + text);
            }
            if (text.charAt(pos) == '}') {
                pos++;
                break;
            }
            int keyStart = pos;
            while (pos < length && text.charAt(pos) != '=') {
                pos++;
            }
            if (pos >= length) {
                throw new IllegalArgumentException("Missing '=' in local params: " + text);
            }
            String key = text.substring(keyStart, pos);
            pos++;

            StringBuilder value = new StringBuilder();
            if (pos < length && (text.charAt(pos) == '\'' || text.charAt(pos) == '"')) {
                char quote = text.charAt(pos++);
                while (pos < length && text.charAt(pos) != quote) {
                    char c = text.charAt(pos++);
                    if (c == '\\' && pos < length) {
                        c = text.charAt(pos++);
                    }
                    value.append(c);
                }
                if (pos >= length) {
                    throw new IllegalArgumentException("Unterminated quoted value in local params: " + text);
                }
                pos++;
            } else {
                while (pos < length && !Character.isWhitespace(text.charAt(pos)) && text.charAt(pos) != '}') {
                    value.append(text.charAt(pos++));
                }
            }
            params.add(new AbstractMap.SimpleImmutableEntry<>(key, value.toString()));
        }
        return new LocalParams(type, params, text.substring(pos));
    }

    private static String quote(String value) {
        boolean needsQuoting = value.isEmpty();
        for (int i = 0; i < value.length() && !needsQuoting; i++) {
            char c = value.charAt(i);
            needsQuoting = Character.isWhitespace(c) || c == '\'' || c == '"' || c == '{' || c == '}' || c == '\\';
        }
        if (!needsQuoting) {
            return value;
        }
        StringBuilder sb = new StringBuilder("'");
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '\'' || c == '\\') {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.append('\'').toString();
    }

    public static class Builder {

        private final String type;
        private final List<Map.Entry<String, String>> params = new ArrayList<>();
        private String body = "";

        private Builder(String type) {
            this.type = type;
        }

        /**
         * Adds a key when the value is present; null is skipped.
         */
        public Builder param(String key, @Nullable Object value) {
            if (value != null) {
                params.add(new AbstractMap.SimpleImmutableEntry<>(key, ParamFormat.render(value)));
            }
            return this;
        }

        /**
         * Adds one {@code key=value} token per entry.
         */
        public Builder params(String key, @Nullable Collection<?> values) {
            if (values != null) {
                values.forEach(v -> param(key, v));
            }
            return this;
        }

        public Builder body(String body) {
            this.body = body;
            return this;
        }

        public LocalParams build() {
            return new LocalParams(type, params, body);
        }
    }
}
