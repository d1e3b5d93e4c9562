package com.example.docfix;

import java.util.List;

/**
 * 逐条审阅的一步。未结束时 next 为下一条待确认的修正；
 * 结束时 done = true，report 为已接受修正的应用结果（一条都没接受时为空），
 * rejected 为用户跳过的修正。
 */
public record ReviewStep(
        boolean done,
        int position,
        int total,
        Fix next,
        FixReport report,
        List<Fix> rejected
) {

    static ReviewStep pending(int position, int total, Fix next) {
        return new ReviewStep(false, position, total, next, null, List.of());
    }

    static ReviewStep finished(int total, FixReport report, List<Fix> rejected) {
        return new ReviewStep(true, total, total, null, report, List.copyOf(rejected));
    }
}
