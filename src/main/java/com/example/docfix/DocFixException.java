package com.example.docfix;

/** 业务异常基类，message 可直接展示给用户 */
public class DocFixException extends RuntimeException {

    public DocFixException(String message) {
        super(message);
    }

    public DocFixException(String message, Throwable cause) {
        super(message, cause);
    }
}
