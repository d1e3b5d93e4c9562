package com.example.docfix;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 一次定位到的匹配。index 在单次 locate 调用内按遍历顺序从 0 递增；
 * sentence 为包含匹配的整句（已 trim）；containerIndex 为段落容器序号。
 */
public record Occurrence(
        int index,
        String sentence,
        @JsonProperty("container_index") int containerIndex
) {}
