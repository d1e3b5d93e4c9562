package com.example.docfix;

/** 上传校验结果；reason 为可直接展示给用户的说明，校验通过时为空串 */
public record ValidationResult(boolean valid, String reason) {

    static ValidationResult ok() { return new ValidationResult(true, ""); }

    static ValidationResult reject(String reason) { return new ValidationResult(false, reason); }
}
