package com.messageworks.core.message;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.messageworks.core.util.AddressUtils;
import lombok.EqualsAndHashCode;

/**
 * 层级地址，由若干非空、去除首尾空白的分段按根到叶的顺序组成。
 * 空分段序列表示根上下文。实例不可变。
 * <p>
 * 序列化为规范字符串形式（例如 {@code /a/b}），反序列化同时接受字符串和字符串数组。
 */
@EqualsAndHashCode
public final class Address {

    private static final Address ROOT = new Address(List.of());

    private final List<String> segments;

    private Address(List<String> segments) {
        this.segments = List.copyOf(segments);
    }

    public static Address root() {
        return ROOT;
    }

    public static Address parse(String address) {
        return of(AddressUtils.toSegments(address));
    }

    public static Address of(String... segments) {
        if (segments == null) {
            throw new IllegalArgumentException("address segments must not be null");
        }
        return of(Arrays.asList(segments));
    }

    public static Address of(List<String> segments) {
        List<String> normalized = AddressUtils.normalize(segments);
        return normalized.isEmpty() ? ROOT : new Address(normalized);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Address fromJson(Object value) {
        if (value == null) {
            return ROOT;
        }
        if (value instanceof String) {
            return parse((String) value);
        }
        if (value instanceof List<?>) {
            List<String> segments = new ArrayList<>();
            for (Object segment : (List<?>) value) {
                segments.add(String.valueOf(segment));
            }
            return of(segments);
        }
        throw new IllegalArgumentException("Unsupported address representation: " + value.getClass().getName());
    }

    public List<String> getSegments() {
        return segments;
    }

    public int depth() {
        return segments.size();
    }

    public boolean isRoot() {
        return segments.isEmpty();
    }

    /**
     * 返回本地址下名为 {@code name} 的直接子地址。
     *
     * @throws IllegalArgumentException name 规范化后不是恰好一个分段
     */
    public Address child(String name) {
        if (name == null) {
            throw new IllegalArgumentException("child name must not be null");
        }
        List<String> childSegments = AddressUtils.toSegments(name);
        if (childSegments.size() != 1) {
            throw new IllegalArgumentException("child name must be a single segment: '" + name + "'");
        }
        List<String> result = new ArrayList<>(segments);
        result.add(childSegments.get(0));
        return new Address(result);
    }

    /**
     * 父地址；根的父地址仍是根。
     */
    public Address parent() {
        if (segments.size() <= 1) {
            return ROOT;
        }
        return new Address(segments.subList(0, segments.size() - 1));
    }

    public String lastSegment() {
        return segments.isEmpty() ? "" : segments.get(segments.size() - 1);
    }

    /**
     * 本地址是否为 {@code other} 的严格祖先。
     */
    public boolean isAncestorOf(Address other) {
        if (other == null || other.segments.size() <= segments.size()) {
            return false;
        }
        return other.segments.subList(0, segments.size()).equals(segments);
    }

    @JsonValue
    @Override
    public String toString() {
        return AddressUtils.ROOT + String.join(AddressUtils.SEPARATOR, segments);
    }
}
