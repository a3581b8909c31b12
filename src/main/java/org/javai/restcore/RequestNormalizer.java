package org.javai.restcore;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import org.javai.restcore.exception.ConfigurationException;

/**
 * Turns caller inputs into a {@link PreparedRequest}. Every structure it returns is freshly
 * built, so nothing the caller passed in is ever modified.
 */
final class RequestNormalizer {

    static final String RAW_JSON = "raw_json";
    static final String API_TYPE = "api_type";

    private static final String URI_CHARACTERS =
            "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789-._~:/?#@!$&'()*+,;=";
    private static final char[] HEX = "0123456789ABCDEF".toCharArray();

    private final ObjectMapper mapper;

    RequestNormalizer(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    PreparedRequest normalize(String method, String baseUrl, String path, RequestOptions options) {
        Objects.requireNonNull(method, "method must not be null");
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(options, "options must not be null");

        return new PreparedRequest(
                method,
                resolve(baseUrl, path),
                params(options.params()),
                body(options),
                options.timeout());
    }

    static String resolve(String baseUrl, String path) {
        try {
            URI base = URI.create(baseUrl);
            if (base.getRawPath() == null || base.getRawPath().isEmpty()) {
                base = URI.create(baseUrl + "/");
            }
            return base.resolve(requote(path)).toString();
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("cannot resolve path " + path + " against " + baseUrl, e);
        }
    }

    /**
     * Percent-encodes every character that may not appear in a URI, as UTF-8 bytes. Existing
     * escapes are kept; a {@code %} that starts no escape is encoded itself.
     */
    static String requote(String path) {
        byte[] bytes = path.getBytes(StandardCharsets.UTF_8);
        StringBuilder quoted = new StringBuilder(bytes.length);
        for (int i = 0; i < bytes.length; i++) {
            int b = bytes[i] & 0xff;
            if (b == '%' && i + 2 < bytes.length && isHex(bytes[i + 1]) && isHex(bytes[i + 2])) {
                quoted.append('%');
            } else if (b < 0x80 && b != '%' && URI_CHARACTERS.indexOf(b) >= 0) {
                quoted.append((char) b);
            } else {
                quoted.append('%').append(HEX[b >> 4]).append(HEX[b & 0xf]);
            }
        }
        return quoted.toString();
    }

    private static boolean isHex(byte b) {
        return (b >= '0' && b <= '9') || (b >= 'a' && b <= 'f') || (b >= 'A' && b <= 'F');
    }

    /**
     * Null values are left out, as an unset parameter.
     */
    private static Map<String, String> params(Map<String, ?> given) {
        Map<String, String> params = new LinkedHashMap<>();
        if (given != null) {
            given.forEach((name, value) -> {
                requireKey(name, "params");
                if (value != null) {
                    params.put(name, String.valueOf(value));
                }
            });
        }
        params.put(RAW_JSON, "1");
        return params;
    }

    private static void requireKey(String name, String option) {
        if (name == null) {
            throw new ConfigurationException(option + " must not contain a null key");
        }
    }

    private RequestBody body(RequestOptions options) {
        boolean form = options.formData() != null || options.formFields() != null;
        if (options.formData() != null && options.formFields() != null) {
            throw new ConfigurationException("data must be given either as a mapping or as form fields, not both");
        }
        if ((form || options.rawData() != null) && options.json() != null) {
            throw new ConfigurationException("data and json cannot both be sent in one request");
        }
        if (form && options.rawData() != null) {
            throw new ConfigurationException("data must be given either as form fields or as raw bytes, not both");
        }
        if (options.rawData() != null && options.files() != null) {
            throw new ConfigurationException("raw data cannot be combined with files");
        }
        if (options.json() != null && options.files() != null) {
            throw new ConfigurationException("json cannot be combined with files");
        }

        List<FormField> fields = null;
        if (options.formData() != null) {
            fields = sortedFields(options.formData());
        } else if (options.formFields() != null) {
            fields = List.copyOf(options.formFields());
        }

        if (options.files() != null) {
            return new RequestBody.Multipart(fields == null ? List.of() : fields, options.files());
        }
        if (fields != null) {
            return new RequestBody.Form(fields);
        }
        if (options.rawData() != null) {
            return new RequestBody.Raw(options.rawData());
        }
        if (options.json() != null) {
            return new RequestBody.Json(jsonDocument(options.json()));
        }
        return RequestBody.empty();
    }

    /**
     * The wire format requires form fields sorted by key. Fields with a null value are dropped.
     */
    static List<FormField> sortedFields(Map<String, ?> data) {
        TreeMap<String, Object> sorted = new TreeMap<>();
        data.forEach((name, value) -> {
            requireKey(name, "data");
            if (value != null) {
                sorted.put(name, value);
            }
        });
        sorted.put(API_TYPE, "json");
        List<FormField> fields = new ArrayList<>(sorted.size());
        sorted.forEach((name, value) -> fields.add(FormField.of(name, value)));
        return fields;
    }

    private JsonNode jsonDocument(Object json) {
        JsonNode document;
        if (json instanceof JsonNode node) {
            document = node.deepCopy();
        } else {
            try {
                document = mapper.valueToTree(json);
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("json body cannot be serialized: " + e.getMessage(), e);
            }
        }
        if (document instanceof ObjectNode object) {
            object.put(API_TYPE, "json");
        }
        return document;
    }
}
