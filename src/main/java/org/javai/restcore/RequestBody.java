package org.javai.restcore;

import com.fasterxml.jackson.databind.JsonNode;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The body of a prepared request. At most one structured form is ever set.
 */
public sealed interface RequestBody
        permits RequestBody.Empty, RequestBody.Form, RequestBody.Raw, RequestBody.Json, RequestBody.Multipart {

    static RequestBody empty() {
        return Empty.INSTANCE;
    }

    /**
     * No body.
     */
    final class Empty implements RequestBody {
        private static final Empty INSTANCE = new Empty();

        private Empty() {}

        @Override
        public String toString() {
            return "Empty";
        }
    }

    /**
     * An {@code application/x-www-form-urlencoded} body, sent in the order given.
     *
     * @param fields the form fields
     */
    record Form(List<FormField> fields) implements RequestBody {
        public Form {
            fields = List.copyOf(fields);
        }
    }

    /**
     * Bytes sent as they are.
     *
     * @param content the body
     */
    record Raw(byte[] content) implements RequestBody {
        public Raw {
            content = Objects.requireNonNull(content, "content must not be null").clone();
        }

        @Override
        public byte[] content() {
            return content.clone();
        }
    }

    /**
     * An {@code application/json} body.
     *
     * @param document the JSON document, copied on the way in and on the way out
     */
    record Json(JsonNode document) implements RequestBody {
        public Json {
            document = Objects.requireNonNull(document, "document must not be null").deepCopy();
        }

        @Override
        public JsonNode document() {
            return document.deepCopy();
        }
    }

    /**
     * A {@code multipart/form-data} body made of plain fields and files.
     *
     * @param fields the plain form fields
     * @param files the files, keyed by form field name
     */
    record Multipart(List<FormField> fields, Map<String, Path> files) implements RequestBody {
        public Multipart {
            fields = List.copyOf(fields);
            files = Collections.unmodifiableMap(new LinkedHashMap<>(files));
        }
    }
}
