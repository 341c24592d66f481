package org.huang.origin.api.validation;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * 字段路径，例如 spec.triggers[2].github.secret。不可变，child/index/key 都返回新对象。
 */
public final class FieldPath {

    private final FieldPath parent;
    private final String name;
    private final String index;

    private FieldPath(FieldPath parent, String name, String index) {
        this.parent = parent;
        this.name = name;
        this.index = index;
    }

    public static FieldPath root(String name, String... moreNames) {
        return new FieldPath(null, name, null).child(moreNames);
    }

    public FieldPath child(String... names) {
        FieldPath path = this;
        for (String n : names) {
            path = new FieldPath(path, n, null);
        }
        return path;
    }

    public FieldPath index(int i) {
        return new FieldPath(this, null, Integer.toString(i));
    }

    public FieldPath key(String key) {
        return new FieldPath(this, null, key);
    }

    @Override
    public String toString() {
        Deque<FieldPath> elems = new ArrayDeque<>();
        for (FieldPath p = this; p != null; p = p.parent) {
            elems.push(p);
        }
        StringBuilder sb = new StringBuilder();
        for (FieldPath p : elems) {
            if (p.index != null) {
                sb.append('[').append(p.index).append(']');
            } else {
                if (sb.length() > 0) {
                    sb.append('.');
                }
                sb.append(p.name);
            }
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof FieldPath && toString().equals(o.toString());
    }

    @Override
    public int hashCode() {
        return toString().hashCode();
    }
}
