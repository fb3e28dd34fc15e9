package com.pitchmate.chat.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 응답 페이로드 트리 (Text | Scalar | Sequence | Mapping)
 * <p>
 * 일반 Java 값(Map / List / String / 기타)과 상호 변환된다.
 */
public interface PayloadNode {

    /**
     * 일반 Java 값으로 되돌린다 (Map / List / String / 원시값).
     */
    Object toPlain();

    record Text(String value) implements PayloadNode {
        @Override
        public Object toPlain() {
            return value;
        }
    }

    record Scalar(Object value) implements PayloadNode {
        @Override
        public Object toPlain() {
            return value;
        }
    }

    record Sequence(List<PayloadNode> items) implements PayloadNode {

        public Sequence {
            items = items == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(items));
        }

        /**
         * 모든 항목이 문자열인지 (빈 리스트 포함)
         */
        public boolean isAllText() {
            return items.stream().allMatch(Text.class::isInstance);
        }

        public List<String> texts() {
            List<String> out = new ArrayList<>(items.size());
            for (PayloadNode n : items) {
                out.add(((Text) n).value());
            }
            return out;
        }

        @Override
        public Object toPlain() {
            List<Object> out = new ArrayList<>(items.size());
            for (PayloadNode n : items) {
                out.add(n.toPlain());
            }
            return out;
        }
    }

    record Mapping(Map<String, PayloadNode> entries) implements PayloadNode {

        public Mapping {
            entries = entries == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(entries));
        }

        @Override
        public Object toPlain() {
            Map<String, Object> out = new LinkedHashMap<>();
            entries.forEach((k, v) -> out.put(k, v.toPlain()));
            return out;
        }
    }

    static PayloadNode text(String value) {
        return new Text(value);
    }

    static PayloadNode of(Object value) {
        if (value instanceof PayloadNode node) {
            return node;
        }
        if (value instanceof CharSequence cs) {
            return new Text(cs.toString());
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, PayloadNode> entries = new LinkedHashMap<>();
            map.forEach((k, v) -> entries.put(String.valueOf(k), of(v)));
            return new Mapping(entries);
        }
        if (value instanceof Iterable<?> iterable) {
            List<PayloadNode> items = new ArrayList<>();
            for (Object o : iterable) {
                items.add(of(o));
            }
            return new Sequence(items);
        }
        return new Scalar(value);
    }
}
