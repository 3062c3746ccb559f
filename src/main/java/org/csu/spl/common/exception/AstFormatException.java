package org.csu.spl.common.exception;

/**
 * @author hidyouth
 * 导出格式 (Map / JSON) 无法还原为 AST 时抛出
 */
public class AstFormatException extends RuntimeException {

    public AstFormatException(String message) {
        super(message);
    }

    public AstFormatException(String message, Throwable cause) {
        super(message, cause);
    }

    public AstFormatException(String type, String key, String expected) {
        super(String.format("Malformed %s: key '%s' expected %s", type, key, expected));
    }
}
