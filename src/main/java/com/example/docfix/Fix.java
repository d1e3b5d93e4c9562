package com.example.docfix;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * 一条查找/替换修正。线上格式：{"search": "...", "replace": "..."}。
 * search 为空或与 replace 相同视为格式错误，应用前即被跳过。
 */
public record Fix(String search, String replace) {

    @JsonIgnore
    public boolean isWellFormed() {
        return search != null && !search.isEmpty() && !search.equals(replace);
    }
}
