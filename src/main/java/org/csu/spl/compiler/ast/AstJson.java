package org.csu.spl.compiler.ast;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.csu.spl.common.exception.AstFormatException;

import java.util.Map;

/**
 * AST 与 JSON 文本之间的转换，建立在 {@link AstSerializer} 和 {@link AstMapReader} 之上。
 */
public final class AstJson {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final ObjectMapper PRETTY_MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() { };

    private AstJson() {
    }

    public static String toJson(AstNode node) {
        return write(MAPPER, node);
    }

    public static String toPrettyJson(AstNode node) {
        return write(PRETTY_MAPPER, node);
    }

    public static Map<String, Object> parseMap(String json) {
        try {
            return MAPPER.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new AstFormatException("Invalid AST JSON: " + e.getOriginalMessage(), e);
        }
    }

    public static AstNode fromJson(String json) {
        return AstMapReader.read(parseMap(json));
    }

    private static String write(ObjectMapper mapper, AstNode node) {
        try {
            return mapper.writeValueAsString(AstSerializer.toMap(node));
        } catch (JsonProcessingException e) {
            throw new AstFormatException("Failed to encode AST as JSON", e);
        }
    }
}
