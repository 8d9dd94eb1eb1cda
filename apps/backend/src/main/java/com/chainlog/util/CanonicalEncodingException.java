package com.chainlog.util;

/**
 * 值无法被确定性地规范化（循环引用、不支持的类型、NaN 等）。
 */
public class CanonicalEncodingException extends RuntimeException {

    public CanonicalEncodingException(String message) {
        super(message);
    }

    public CanonicalEncodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
