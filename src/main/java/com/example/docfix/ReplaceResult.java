package com.example.docfix;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.nio.file.Path;
import java.util.Optional;

/** 单条查找/替换的结果：新文件（若有）与替换总次数 */
public record ReplaceResult(@JsonIgnore Path artifact, int replacements, EditStatus status) {

    static ReplaceResult noChange() { return new ReplaceResult(null, 0, EditStatus.NO_CHANGE); }

    static ReplaceResult failed() { return new ReplaceResult(null, 0, EditStatus.FAILED); }

    public Optional<Path> artifactPath() { return Optional.ofNullable(artifact); }
}
