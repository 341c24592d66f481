package org.huang.origin.registry.storage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 字段选择器：若干 {@code field=value} / {@code field!=value} 条件的合取。没有条件时匹配所有对象。
 */
public final class FieldSelector {

    private static final FieldSelector EVERYTHING = new FieldSelector(List.of());

    private final List<Term> terms;

    private FieldSelector(List<Term> terms) {
        this.terms = terms;
    }

    public static FieldSelector everything() {
        return EVERYTHING;
    }

    public static FieldSelector oneTermEqual(String field, String value) {
        return new FieldSelector(List.of(new Term(field, value, false)));
    }

    public static FieldSelector oneTermNotEqual(String field, String value) {
        return new FieldSelector(List.of(new Term(field, value, true)));
    }

    /**
     * 每个 entry 都是一个相等条件
     */
    public static FieldSelector fromMap(Map<String, String> fields) {
        List<Term> terms = new ArrayList<>();
        fields.forEach((k, v) -> terms.add(new Term(k, v, false)));
        return new FieldSelector(Collections.unmodifiableList(terms));
    }

    public boolean isEmpty() {
        return terms.isEmpty();
    }

    /**
     * 对象中不存在的字段按空字符串处理
     */
    public boolean matches(Map<String, String> fields) {
        for (Term term : terms) {
            String actual = fields.getOrDefault(term.field, "");
            boolean equal = Objects.equals(actual, term.value);
            if (equal == term.negated) {
                return false;
            }
        }
        return true;
    }

    /**
     * 如果存在 field=value 形式的条件，返回其中的值
     */
    public Optional<String> requiresExactMatch(String field) {
        return terms.stream()
                .filter(t -> !t.negated && t.field.equals(field))
                .map(t -> t.value)
                .findFirst();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Term term : terms) {
            if (sb.length() > 0) {
                sb.append(',');
            }
            sb.append(term.field).append(term.negated ? "!=" : "=").append(term.value);
        }
        return sb.toString();
    }

    private static final class Term {
        private final String field;
        private final String value;
        private final boolean negated;

        private Term(String field, String value, boolean negated) {
            this.field = Objects.requireNonNull(field, "field");
            this.value = value == null ? "" : value;
            this.negated = negated;
        }
    }
}
