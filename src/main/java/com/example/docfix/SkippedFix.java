package com.example.docfix;

public record SkippedFix(Fix fix, Reason reason) {

    public enum Reason {
        /** search 为空或 search == replace */
        MALFORMED,
        /** 文档中没有任何容器发生替换 */
        NOT_FOUND,
        /** 读写文档失败，整批未生效 */
        ERROR
    }
}
