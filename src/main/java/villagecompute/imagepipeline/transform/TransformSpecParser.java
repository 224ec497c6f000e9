/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.imagepipeline.transform;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import villagecompute.imagepipeline.exceptions.ValidationException;

/**
 * Builds {@link TransformSpec} values from their two wire forms.
 *
 * <p>
 * <b>JSON form</b> (request bodies): a list of objects, each with an {@code op} key plus the operation parameters:
 *
 * <pre>
 * [{"op": "resize", "width": 400}, {"op": "rotate", "degrees": 90}]
 * </pre>
 *
 * <p>
 * <b>Compact form</b> (query strings): the canonical encoding, {@code resize(width=400)|rotate(degrees=90)}.
 *
 * <p>
 * Parameter values are coerced to canonical types: numbers given as strings or as integral decimals ({@code 400.0})
 * are accepted for integer parameters. Unknown operations and unknown parameter keys are rejected. No defaults are
 * filled in.
 */
public final class TransformSpecParser {

    private static final String OP_KEY = "op";

    private TransformSpecParser() {
        // Utility class, no instantiation
    }

    /**
     * Parses the JSON form.
     *
     * @param operations
     *            deserialized operation objects, may be null or empty for the identity spec
     * @return parsed spec
     * @throws ValidationException
     *             on any malformed operation
     */
    public static TransformSpec fromOperations(List<Map<String, Object>> operations) {
        if (operations == null || operations.isEmpty()) {
            return TransformSpec.empty();
        }
        List<TransformOperation> parsed = new ArrayList<>(operations.size());
        for (int i = 0; i < operations.size(); i++) {
            Map<String, Object> raw = operations.get(i);
            if (raw == null) {
                throw new ValidationException("Operation " + (i + 1) + " is null");
            }
            Map<String, Object> params = new LinkedHashMap<>(raw);
            Object name = params.remove(OP_KEY);
            if (!(name instanceof String opName)) {
                throw new ValidationException("Operation " + (i + 1) + " is missing '" + OP_KEY + "'");
            }
            parsed.add(toOperation(OperationKind.fromWireName(opName), params));
        }
        return new TransformSpec(parsed);
    }

    /**
     * Parses the compact form, e.g. {@code crop(x=0,y=0,width=100,height=100)|grayscale()}.
     *
     * @param compact
     *            compact encoding, blank for the identity spec
     * @return parsed spec
     * @throws ValidationException
     *             on any malformed operation
     */
    public static TransformSpec fromCompact(String compact) {
        if (compact == null || compact.isBlank()) {
            return TransformSpec.empty();
        }
        List<TransformOperation> parsed = new ArrayList<>();
        for (String token : compact.split("\\|")) {
            String trimmed = token.trim();
            int open = trimmed.indexOf('(');
            if (open <= 0 || !trimmed.endsWith(")")) {
                throw new ValidationException("Malformed operation: '" + trimmed + "'");
            }
            OperationKind kind = OperationKind.fromWireName(trimmed.substring(0, open));
            String body = trimmed.substring(open + 1, trimmed.length() - 1).trim();
            Map<String, Object> params = new LinkedHashMap<>();
            if (!body.isEmpty()) {
                for (String pair : body.split(",")) {
                    int eq = pair.indexOf('=');
                    if (eq <= 0) {
                        throw new ValidationException("Malformed parameter '" + pair + "' in " + kind.wireName());
                    }
                    String key = pair.substring(0, eq).trim();
                    if (params.put(key, pair.substring(eq + 1).trim()) != null) {
                        throw new ValidationException("Duplicate parameter '" + key + "' in " + kind.wireName());
                    }
                }
            }
            parsed.add(toOperation(kind, params));
        }
        return new TransformSpec(parsed);
    }

    private static TransformOperation toOperation(OperationKind kind, Map<String, Object> params) {
        for (String key : params.keySet()) {
            if (!kind.parameterKeys().contains(key)) {
                throw new ValidationException("Unknown parameter '" + key + "' for " + kind.wireName());
            }
        }
        return switch (kind) {
            case RESIZE -> new TransformOperation.Resize(optionalInt(params, "width", kind),
                    optionalInt(params, "height", kind));
            case CROP -> new TransformOperation.Crop(requiredInt(params, "x", kind), requiredInt(params, "y", kind),
                    requiredInt(params, "width", kind), requiredInt(params, "height", kind));
            case ROTATE -> new TransformOperation.Rotate(requiredDouble(params, "degrees", kind));
            case FLIP -> new TransformOperation.Flip(
                    TransformOperation.FlipAxis.fromName(requiredString(params, "axis", kind)));
            case WATERMARK -> new TransformOperation.Watermark(requiredString(params, "overlay", kind),
                    TransformOperation.WatermarkPosition.fromName(requiredString(params, "position", kind)),
                    requiredDouble(params, "opacity", kind));
            case FORMAT -> new TransformOperation.Format(OutputFormat.fromName(requiredString(params, "target", kind)));
            case GRAYSCALE -> new TransformOperation.Grayscale();
            case SEPIA -> new TransformOperation.Sepia();
            case MIRROR -> new TransformOperation.Mirror();
            case COMPRESS -> new TransformOperation.Compress(requiredInt(params, "quality", kind));
        };
    }

    private static Object required(Map<String, Object> params, String key, OperationKind kind) {
        Object value = params.get(key);
        if (value == null || (value instanceof String s && s.isBlank())) {
            throw new ValidationException(kind.wireName() + " requires '" + key + "'");
        }
        return value;
    }

    private static String requiredString(Map<String, Object> params, String key, OperationKind kind) {
        return required(params, key, kind).toString();
    }

    private static Integer optionalInt(Map<String, Object> params, String key, OperationKind kind) {
        Object value = params.get(key);
        if (value == null) {
            return null;
        }
        return toInt(value, key, kind);
    }

    private static int requiredInt(Map<String, Object> params, String key, OperationKind kind) {
        return toInt(required(params, key, kind), key, kind);
    }

    private static double requiredDouble(Map<String, Object> params, String key, OperationKind kind) {
        return toDecimal(required(params, key, kind), key, kind).doubleValue();
    }

    private static int toInt(Object value, String key, OperationKind kind) {
        BigDecimal decimal = toDecimal(value, key, kind);
        try {
            return decimal.stripTrailingZeros().intValueExact();
        } catch (ArithmeticException e) {
            throw new ValidationException(kind.wireName() + " '" + key + "' must be an integer, got: " + value, e);
        }
    }

    private static BigDecimal toDecimal(Object value, String key, OperationKind kind) {
        if (value instanceof Boolean) {
            throw new ValidationException(kind.wireName() + " '" + key + "' must be numeric, got: " + value);
        }
        try {
            if (value instanceof BigDecimal decimal) {
                return decimal;
            }
            if (value instanceof Integer || value instanceof Long || value instanceof Short) {
                return BigDecimal.valueOf(((Number) value).longValue());
            }
            if (value instanceof Number number) {
                return new BigDecimal(number.toString());
            }
            return new BigDecimal(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new ValidationException(kind.wireName() + " '" + key + "' must be numeric, got: " + value, e);
        }
    }
}
