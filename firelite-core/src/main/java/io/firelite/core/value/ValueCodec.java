package io.firelite.core.value;

import java.util.ArrayList;
import java.util.Base64;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import io.firelite.core.error.FireliteException;

/**
 * Converts between {@link Value} and its JSON wire representation, where each
 * value is an object holding exactly one type-specific key such as
 * {@code {"integerValue": "42"}}.
 */
public final class ValueCodec {
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;
    private static final Pattern BASE64 = Pattern.compile("^[A-Za-z0-9+/=_-]*$");
    private static final Pattern REFERENCE = Pattern.compile("^projects/[^/]+/databases/[^/]+/documents/.+$");

    private ValueCodec() {
    }

    public static Value decode(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw FireliteException.invalidArgument("Value must be a JSON object");
        }
        if (node.size() == 0) {
            throw FireliteException.invalidArgument("Empty Value object");
        }
        if (node.size() > 1) {
            throw FireliteException.invalidArgument("Value object must have exactly one type field");
        }
        String key = node.fieldNames().next();
        Value.Kind kind = Value.Kind.fromWireName(key);
        if (kind == null) {
            throw FireliteException.invalidArgument("Unsupported Value type: " + key);
        }
        JsonNode body = node.get(key);
        switch (kind) {
            case NULL:
                return Value.nullValue();
            case BOOLEAN:
                if (!body.isBoolean()) {
                    throw FireliteException.invalidArgument("booleanValue must be a boolean");
                }
                return new Value.BooleanValue(body.booleanValue());
            case INTEGER:
                return new Value.IntegerValue(decodeInteger(body));
            case DOUBLE:
                return new Value.DoubleValue(decodeDouble(body));
            case TIMESTAMP:
                return new Value.TimestampValue(decodeTimestamp(body));
            case STRING:
                if (!body.isTextual()) {
                    throw FireliteException.invalidArgument("stringValue must be a string");
                }
                return new Value.StringValue(body.textValue());
            case BYTES:
                return new Value.BytesValue(decodeBytes(body));
            case REFERENCE:
                if (!body.isTextual() || !REFERENCE.matcher(body.textValue()).matches()) {
                    throw FireliteException.invalidArgument("Invalid referenceValue format: " + body);
                }
                return new Value.ReferenceValue(body.textValue());
            case GEO_POINT:
                return decodeGeoPoint(body);
            case ARRAY:
                return new Value.ArrayValue(decodeArray(body));
            case MAP:
                if (!body.isObject()) {
                    throw FireliteException.invalidArgument("mapValue must be an object");
                }
                return new Value.MapValue(decodeFields(body.get("fields")));
            default:
                throw FireliteException.invalidArgument("Unsupported Value type: " + key);
        }
    }

    /**
     * Decodes a {@code fields} object. A missing or null node yields an empty map.
     */
    public static Map<String, Value> decodeFields(JsonNode fields) {
        Map<String, Value> result = new LinkedHashMap<>();
        if (fields == null || fields.isNull()) {
            return result;
        }
        if (!fields.isObject()) {
            throw FireliteException.invalidArgument("fields must be an object");
        }
        Iterator<Map.Entry<String, JsonNode>> it = fields.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            result.put(entry.getKey(), decode(entry.getValue()));
        }
        return result;
    }

    public static List<Value> decodeArray(JsonNode arrayValue) {
        List<Value> values = new ArrayList<>();
        if (arrayValue == null || arrayValue.isNull()) {
            return values;
        }
        if (!arrayValue.isObject()) {
            throw FireliteException.invalidArgument("arrayValue must be an object");
        }
        JsonNode items = arrayValue.get("values");
        if (items == null || items.isNull()) {
            return values;
        }
        if (!items.isArray()) {
            throw FireliteException.invalidArgument("arrayValue.values must be an array");
        }
        for (JsonNode item : items) {
            values.add(decode(item));
        }
        return values;
    }

    public static ObjectNode encode(Value value) {
        ObjectNode node = NODES.objectNode();
        String key = value.kind().wireName();
        switch (value.kind()) {
            case NULL:
                node.putNull(key);
                break;
            case BOOLEAN:
                node.put(key, ((Value.BooleanValue) value).value());
                break;
            case INTEGER:
                node.put(key, Long.toString(((Value.IntegerValue) value).value()));
                break;
            case DOUBLE:
                double d = ((Value.DoubleValue) value).value();
                if (Double.isNaN(d)) {
                    node.put(key, "NaN");
                } else if (Double.isInfinite(d)) {
                    node.put(key, d > 0 ? "Infinity" : "-Infinity");
                } else {
                    node.put(key, d);
                }
                break;
            case TIMESTAMP:
                node.put(key, Timestamps.format(((Value.TimestampValue) value).value()));
                break;
            case STRING:
                node.put(key, ((Value.StringValue) value).value());
                break;
            case BYTES:
                node.put(key, Base64.getEncoder().encodeToString(((Value.BytesValue) value).value()));
                break;
            case REFERENCE:
                node.put(key, ((Value.ReferenceValue) value).value());
                break;
            case GEO_POINT:
                Value.GeoPointValue geo = (Value.GeoPointValue) value;
                node.putObject(key).put("latitude", geo.latitude()).put("longitude", geo.longitude());
                break;
            case ARRAY:
                ArrayNode values = node.putObject(key).putArray("values");
                for (Value item : ((Value.ArrayValue) value).values()) {
                    values.add(encode(item));
                }
                break;
            case MAP:
                node.putObject(key).set("fields", encodeFields(((Value.MapValue) value).fields()));
                break;
            default:
                throw new IllegalStateException("Unhandled value kind " + value.kind());
        }
        return node;
    }

    public static ObjectNode encodeFields(Map<String, Value> fields) {
        ObjectNode node = NODES.objectNode();
        for (Map.Entry<String, Value> entry : fields.entrySet()) {
            node.set(entry.getKey(), encode(entry.getValue()));
        }
        return node;
    }

    private static long decodeInteger(JsonNode body) {
        if (body.isIntegralNumber() && body.canConvertToLong()) {
            return body.longValue();
        }
        if (body.isTextual()) {
            try {
                return Long.parseLong(body.textValue().trim());
            } catch (NumberFormatException e) {
                throw FireliteException.invalidArgument("Invalid integerValue: " + body.textValue());
            }
        }
        throw FireliteException.invalidArgument("Invalid integerValue: " + body);
    }

    private static double decodeDouble(JsonNode body) {
        if (body.isNumber()) {
            return body.doubleValue();
        }
        if (body.isTextual()) {
            switch (body.textValue()) {
                case "NaN":
                    return Double.NaN;
                case "Infinity":
                    return Double.POSITIVE_INFINITY;
                case "-Infinity":
                    return Double.NEGATIVE_INFINITY;
                default:
                    try {
                        return Double.parseDouble(body.textValue());
                    } catch (NumberFormatException e) {
                        throw FireliteException.invalidArgument("Invalid doubleValue: " + body.textValue());
                    }
            }
        }
        throw FireliteException.invalidArgument("Invalid doubleValue: " + body);
    }

    private static java.time.Instant decodeTimestamp(JsonNode body) {
        if (body.isTextual()) {
            return Timestamps.parse(body.textValue());
        }
        if (body.isObject()) {
            JsonNode seconds = body.get("seconds");
            JsonNode nanos = body.get("nanos");
            long s = seconds == null ? 0 : (seconds.isTextual() ? parseLong(seconds.textValue()) : seconds.asLong());
            int n = nanos == null ? 0 : nanos.asInt();
            return Timestamps.fromSecondsAndNanos(s, n);
        }
        throw FireliteException.invalidArgument("Invalid timestampValue: " + body);
    }

    private static long parseLong(String text) {
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            throw FireliteException.invalidArgument("Invalid timestamp seconds: " + text);
        }
    }

    private static byte[] decodeBytes(JsonNode body) {
        if (!body.isTextual()) {
            throw FireliteException.invalidArgument("bytesValue must be a base64 string");
        }
        String text = body.textValue();
        if (!BASE64.matcher(text).matches()) {
            throw FireliteException.invalidArgument("Invalid base64 string: contains invalid characters");
        }
        try {
            return Base64.getDecoder().decode(text.replace('-', '+').replace('_', '/'));
        } catch (IllegalArgumentException e) {
            throw FireliteException.invalidArgument("Invalid base64 string: " + e.getMessage());
        }
    }

    private static Value decodeGeoPoint(JsonNode body) {
        if (!body.isObject()) {
            throw FireliteException.invalidArgument("geoPointValue must be an object");
        }
        JsonNode latitude = body.get("latitude");
        JsonNode longitude = body.get("longitude");
        if (latitude == null || !latitude.isNumber()) {
            throw FireliteException.invalidArgument("geoPointValue missing latitude");
        }
        if (longitude == null || !longitude.isNumber()) {
            throw FireliteException.invalidArgument("geoPointValue missing longitude");
        }
        return new Value.GeoPointValue(latitude.doubleValue(), longitude.doubleValue());
    }
}
