package ru.aritmos.discharge.safety;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Вердикт проверки безопасности.
 *
 * @param status итог: PASS, FLAGGED или BLOCKED
 * @param findings найденные нарушения в порядке проверок
 */
public record SafetyVerdict(Status status, List<Finding> findings) {

    public SafetyVerdict {
        findings = findings == null ? List.of() : List.copyOf(findings);
    }

    public enum Status {
        PASS,
        FLAGGED,
        BLOCKED
    }

    /**
     * Одно нарушение.
     *
     * @param flag вид
     * @param detail пояснение (без ПДн)
     * @param blocking блокирует ли нарушение выдачу результата
     */
    public record Finding(SafetyFlag flag, String detail, boolean blocking) {
    }

    static SafetyVerdict of(List<Finding> findings) {
        boolean blocked = findings.stream().anyMatch(Finding::blocking);
        Status status = blocked ? Status.BLOCKED : (findings.isEmpty() ? Status.PASS : Status.FLAGGED);
        return new SafetyVerdict(status, findings);
    }

    public boolean isBlocked() {
        return status == Status.BLOCKED;
    }

    /**
     * Уникальные флаги в порядке появления.
     */
    public List<SafetyFlag> flags() {
        Set<SafetyFlag> out = new LinkedHashSet<>();
        findings.forEach(f -> out.add(f.flag()));
        return new ArrayList<>(out);
    }

    /**
     * Пояснения в виде «kind: detail».
     */
    public List<String> describe() {
        return findings.stream().map(f -> f.flag().kind() + ": " + f.detail()).toList();
    }
}
