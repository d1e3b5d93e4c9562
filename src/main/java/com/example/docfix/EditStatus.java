package com.example.docfix;

/** 文档编辑结果：已生成新文件 / 文本不存在无需修改 / 处理失败 */
public enum EditStatus {
    CHANGED,
    NO_CHANGE,
    FAILED
}
