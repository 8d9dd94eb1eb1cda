package com.chainlog.util;

import com.fasterxml.jackson.core.JsonFactoryBuilder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.SerializableString;
import com.fasterxml.jackson.core.io.CharacterEscapes;
import com.fasterxml.jackson.core.io.NumberOutput;
import com.fasterxml.jackson.core.io.SerializedString;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.*;
import com.fasterxml.jackson.databind.util.RawValue;

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.*;

/**
 * 作为哈希输入的确定性 JSON 编码。
 *
 * 输出与 Python {@code json.dumps(v, sort_keys=True, separators=(",", ":"))} 逐字节一致：
 *   - 每一层的 key 按码点排序，无空白
 *   - 可打印 ASCII 以外的字符一律写成小写 {@code \\uXXXX}
 *   - 浮点数按 {@code repr(float)} 的格式输出
 *
 * 先把值归一化成 Jackson 树（{@link ObjectNode} 已排序，浮点数为原始文本），
 * 再交给这里固定了 {@link CharacterEscapes} 的 mapper 写出，结果与应用自身的 ObjectMapper 配置无关。
 */
public final class JsonCanonicalizer {

    static final int MAX_DEPTH = 1000;

    /** Python 的 sort_keys 按码点比较；String.compareTo 按 UTF-16 单元，两者在代理对上不一致 */
    public static final Comparator<String> CODE_POINT_ORDER = (a, b) -> {
        int i = 0;
        while (i < a.length() && i < b.length()) {
            int ca = a.codePointAt(i);
            int cb = b.codePointAt(i);
            if (ca != cb) return Integer.compare(ca, cb);
            i += Character.charCount(ca);
        }
        return Integer.compare(a.length(), b.length());
    };

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private static final ObjectMapper MAPPER = JsonMapper.builder(
            new JsonFactoryBuilder().characterEscapes(new AsciiOnlyEscapes()).build()
    ).build();

    private JsonCanonicalizer() {}

    public static String canonicalize(Object value) {
        JsonNode norm = normalize(value);
        try {
            return MAPPER.writeValueAsString(norm);
        } catch (JsonProcessingException e) {
            throw new CanonicalEncodingException("canonical write failed: " + e.getOriginalMessage(), e);
        }
    }

    /** 输出只含 ASCII，因此按 ASCII 取字节即为 UTF-8 字节 */
    public static byte[] canonicalBytes(Object value) {
        return canonicalize(value).getBytes(StandardCharsets.US_ASCII);
    }

    /**
     * Converts a value tree into a normalized Jackson tree.
     *
     * @throws CanonicalEncodingException for cycles, sets, non-finite numbers, unsupported
     *                                    types or map keys, and excessive nesting
     */
    public static JsonNode normalize(Object value) {
        return normalize(value, Collections.newSetFromMap(new IdentityHashMap<>()), 0);
    }

    private static JsonNode normalize(Object value, Set<Object> path, int depth) {
        if (value == null) return NullNode.getInstance();
        if (value instanceof JsonNode node) return normalizeNode(node, path, depth);
        if (value instanceof CharSequence cs) return TextNode.valueOf(cs.toString());
        if (value instanceof Character c) return TextNode.valueOf(String.valueOf(c));
        if (value instanceof Boolean b) return BooleanNode.valueOf(b);
        if (value instanceof Number n) return numberNode(n);

        if (value instanceof Map<?, ?> map) {
            enter(value, path, depth);
            try {
                return objectNode(map, path, depth + 1);
            } finally {
                path.remove(value);
            }
        }
        if (value instanceof Set<?>) {
            throw new CanonicalEncodingException("sets have no defined order: " + value.getClass().getName());
        }
        if (value instanceof Collection<?> coll) {
            enter(value, path, depth);
            try {
                ArrayNode arr = NODES.arrayNode(coll.size());
                for (Object it : coll) arr.add(normalize(it, path, depth + 1));
                return arr;
            } finally {
                path.remove(value);
            }
        }
        if (value.getClass().isArray() && !(value instanceof byte[])) {
            enter(value, path, depth);
            try {
                int len = Array.getLength(value);
                ArrayNode arr = NODES.arrayNode(len);
                for (int i = 0; i < len; i++) arr.add(normalize(Array.get(value, i), path, depth + 1));
                return arr;
            } finally {
                path.remove(value);
            }
        }
        throw new CanonicalEncodingException("unsupported type: " + value.getClass().getName());
    }

    private static JsonNode normalizeNode(JsonNode node, Set<Object> path, int depth) {
        if (node.isNull() || node.isMissingNode()) return NullNode.getInstance();
        if (node.isTextual()) return TextNode.valueOf(node.textValue());
        if (node.isBoolean()) return BooleanNode.valueOf(node.booleanValue());
        if (node.isIntegralNumber()) return BigIntegerNode.valueOf(node.bigIntegerValue());
        if (node.isBigDecimal()) return decimalNode(node.decimalValue());
        if (node.isFloatingPointNumber()) return floatNode(node.doubleValue());
        if (node.isPojo()) return normalize(((POJONode) node).getPojo(), path, depth);

        if (node.isObject()) {
            enter(node, path, depth);
            try {
                List<String> fields = new ArrayList<>();
                node.fieldNames().forEachRemaining(fields::add);
                fields.sort(CODE_POINT_ORDER);
                ObjectNode dst = NODES.objectNode();
                for (String f : fields) dst.set(f, normalize(node.get(f), path, depth + 1));
                return dst;
            } finally {
                path.remove(node);
            }
        }
        if (node.isArray()) {
            enter(node, path, depth);
            try {
                ArrayNode arr = NODES.arrayNode(node.size());
                for (JsonNode it : node) arr.add(normalize(it, path, depth + 1));
                return arr;
            } finally {
                path.remove(node);
            }
        }
        throw new CanonicalEncodingException("unsupported JSON node: " + node.getNodeType());
    }

    private static ObjectNode objectNode(Map<?, ?> map, Set<Object> path, int depth) {
        TreeMap<String, Object> sorted = new TreeMap<>(CODE_POINT_ORDER);
        for (Map.Entry<?, ?> e : map.entrySet()) {
            String key = keyText(e.getKey());
            if (sorted.containsKey(key)) {
                throw new CanonicalEncodingException("duplicate key after stringification: " + key);
            }
            sorted.put(key, e.getValue());
        }
        ObjectNode dst = NODES.objectNode();
        for (Map.Entry<String, Object> e : sorted.entrySet()) {
            dst.set(e.getKey(), normalize(e.getValue(), path, depth));
        }
        return dst;
    }

    private static void enter(Object container, Set<Object> path, int depth) {
        if (depth >= MAX_DEPTH) {
            throw new CanonicalEncodingException("nesting deeper than " + MAX_DEPTH + " levels");
        }
        if (!path.add(container)) {
            throw new CanonicalEncodingException("circular reference detected");
        }
    }

    // ===== 数字 =====

    private static JsonNode numberNode(Number n) {
        if (n instanceof Integer || n instanceof Long || n instanceof Short || n instanceof Byte) {
            return LongNode.valueOf(n.longValue());
        }
        if (n instanceof BigInteger bi) return BigIntegerNode.valueOf(bi);
        if (n instanceof Double || n instanceof Float) return floatNode(n.doubleValue());
        if (n instanceof BigDecimal bd) return decimalNode(bd);
        throw new CanonicalEncodingException("unsupported number type: " + n.getClass().getName());
    }

    /** 无小数位 → 整数；有小数位且恰好是某个 double 的最短表示 → 浮点；否则拒绝 */
    private static JsonNode decimalNode(BigDecimal bd) {
        if (bd.scale() <= 0) return BigIntegerNode.valueOf(bd.toBigIntegerExact());
        double d = bd.doubleValue();
        if (Double.isFinite(d) && new BigDecimal(NumberOutput.toString(d, true)).compareTo(bd) == 0) {
            return floatNode(d);
        }
        throw new CanonicalEncodingException("decimal has no exact float form: " + bd.toPlainString());
    }

    private static JsonNode floatNode(double d) {
        return NODES.rawValueNode(new RawValue(floatText(d)));
    }

    /**
     * Renders a double the way Python's {@code repr(float)} does: shortest round-trip digits,
     * fixed notation for decimal exponents in [-4, 16), scientific otherwise.
     */
    static String floatText(double d) {
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            throw new CanonicalEncodingException("non-finite float: " + d);
        }
        if (d == 0.0) return (Double.doubleToRawLongBits(d) < 0) ? "-0.0" : "0.0";

        BigDecimal shortest = new BigDecimal(NumberOutput.toString(d, true)).stripTrailingZeros();
        String digits = shortest.unscaledValue().abs().toString();
        String sign = shortest.signum() < 0 ? "-" : "";
        int n = digits.length();
        int decpt = n - shortest.scale();   // value = 0.<digits> * 10^decpt

        if (decpt > -4 && decpt <= 16) {
            if (decpt <= 0) return sign + "0." + "0".repeat(-decpt) + digits;
            if (decpt >= n) return sign + digits + "0".repeat(decpt - n) + ".0";
            return sign + digits.substring(0, decpt) + "." + digits.substring(decpt);
        }
        int exp = decpt - 1;
        String mantissa = (n == 1) ? digits : digits.charAt(0) + "." + digits.substring(1);
        int absExp = Math.abs(exp);
        return sign + mantissa + "e" + (exp < 0 ? "-" : "+") + (absExp < 10 ? "0" : "") + absExp;
    }

    private static String keyText(Object key) {
        if (key == null) return "null";
        if (key instanceof CharSequence || key instanceof Character) return key.toString();
        if (key instanceof Boolean b) return b ? "true" : "false";
        if (key instanceof Number n) {
            JsonNode num = numberNode(n);
            if (num.isPojo()) return String.valueOf(((RawValue) ((POJONode) num).getPojo()).rawValue());
            return num.asText();
        }
        throw new CanonicalEncodingException("unsupported map key type: " + key.getClass().getName());
    }

    /**
     * ensure_ascii 语义：除 \b \f \n \r \t 与 \" \\ 外，所有非可打印 ASCII 字符一律 \\u 小写十六进制转义。
     */
    static final class AsciiOnlyEscapes extends CharacterEscapes {
        private final int[] asciiEscapes;

        AsciiOnlyEscapes() {
            int[] esc = CharacterEscapes.standardAsciiEscapesForJSON();
            for (int c = 0; c < 0x20; c++) {
                if (esc[c] == CharacterEscapes.ESCAPE_STANDARD) esc[c] = CharacterEscapes.ESCAPE_CUSTOM;
            }
            esc[0x7F] = CharacterEscapes.ESCAPE_CUSTOM;
            this.asciiEscapes = esc;
        }

        @Override
        public int[] getEscapeCodesForAscii() {
            return asciiEscapes;
        }

        @Override
        public SerializableString getEscapeSequence(int ch) {
            if (ch < 0x20 || ch >= 0x7F) {
                return new SerializedString(String.format("\\u%04x", ch));
            }
            return null;
        }
    }
}
