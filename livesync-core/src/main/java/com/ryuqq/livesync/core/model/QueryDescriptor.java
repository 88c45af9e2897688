package com.ryuqq.livesync.core.model;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * 원격 컬렉션(또는 단일 문서)에 대한 논리 쿼리.
 *
 * <p>쿼리는 다음 요소로 구성됩니다:</p>
 * <ul>
 *   <li>collectionPath: 컬렉션 경로 (예: projects/p1/phases/ph1/lists)</li>
 *   <li>documentId: 단일 문서 구독인 경우 문서 ID (컬렉션 쿼리는 null)</li>
 *   <li>equalityFilters: 필드 동등 조건 (field == value)</li>
 *   <li>arrayContainsFilters: 배열 포함 조건 (value ∈ field)</li>
 *   <li>orderBy: 정렬 필드 (없으면 null)</li>
 * </ul>
 *
 * <p><strong>정규화:</strong> 필터는 필드명 기준으로 정렬되어 저장되므로
 * 조건을 추가한 순서와 무관하게 동일한 쿼리는 동일한 {@link SubscriptionKey}를 생성합니다.
 * 반대로 서로 다른 쿼리는 서로 다른 키를 생성합니다: 구분 문자는 퍼센트 인코딩되고,
 * 필터 값에는 타입 태그가 붙으며, 문서 쿼리는 {@code @}로 구분됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * QueryDescriptor query = QueryDescriptor.collection("projects/p1/phases")
 *     .orderBy("order");
 *
 * SubscriptionKey key = query.toKey(); // "projects/p1/phases#order"
 * </pre>
 *
 * @param collectionPath 컬렉션 경로 (필수)
 * @param documentId 단일 문서 ID (컬렉션 쿼리는 null)
 * @param equalityFilters 동등 필터 (정렬된 불변 맵)
 * @param arrayContainsFilters 배열 포함 필터 (정렬된 불변 맵)
 * @param orderBy 정렬 필드 (선택)
 *
 * @author LiveSync Team
 * @since 1.0.0
 */
public record QueryDescriptor(
    String collectionPath,
    String documentId,
    SortedMap<String, Object> equalityFilters,
    SortedMap<String, Object> arrayContainsFilters,
    String orderBy
) {

    private static final char[] HEX = "0123456789ABCDEF".toCharArray();

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 경로가 비어 있거나, 문서 쿼리에 필터/정렬이 지정된 경우
     */
    public QueryDescriptor {
        if (collectionPath == null || collectionPath.isBlank()) {
            throw new IllegalArgumentException("collectionPath cannot be null or blank");
        }
        if (collectionPath.startsWith("/") || collectionPath.endsWith("/")) {
            throw new IllegalArgumentException("collectionPath must not start or end with '/': " + collectionPath);
        }
        equalityFilters = immutableCopy(equalityFilters, "equalityFilters");
        arrayContainsFilters = immutableCopy(arrayContainsFilters, "arrayContainsFilters");
        if (orderBy != null && orderBy.isBlank()) {
            throw new IllegalArgumentException("orderBy cannot be blank");
        }
        if (documentId != null) {
            EntityId.of(documentId);
            if (!equalityFilters.isEmpty() || !arrayContainsFilters.isEmpty() || orderBy != null) {
                throw new IllegalArgumentException("document query cannot have filters or orderBy");
            }
        }
    }

    /**
     * 컬렉션 쿼리 생성.
     *
     * @param collectionPath 컬렉션 경로
     * @return 필터/정렬이 없는 컬렉션 쿼리
     */
    public static QueryDescriptor collection(String collectionPath) {
        return new QueryDescriptor(collectionPath, null, null, null, null);
    }

    /**
     * 단일 문서 쿼리 생성.
     *
     * @param collectionPath 문서가 속한 컬렉션 경로
     * @param documentId 문서 ID
     * @return 단일 문서 쿼리
     */
    public static QueryDescriptor document(String collectionPath, String documentId) {
        if (documentId == null) {
            throw new IllegalArgumentException("documentId cannot be null");
        }
        return new QueryDescriptor(collectionPath, documentId, null, null, null);
    }

    /**
     * 사용자가 멤버로 속한 프로젝트 목록.
     */
    public static QueryDescriptor projectsForMember(String userId) {
        return collection("projects").whereArrayContains("memberIds", userId);
    }

    /**
     * 프로젝트 하위 페이즈 목록 (order 정렬).
     */
    public static QueryDescriptor phases(String projectId) {
        return collection("projects/" + projectId + "/phases").orderBy("order");
    }

    /**
     * 페이즈 하위 태스크 리스트 목록 (order 정렬).
     */
    public static QueryDescriptor taskLists(String projectId, String phaseId) {
        return collection("projects/" + projectId + "/phases/" + phaseId + "/lists").orderBy("order");
    }

    /**
     * 태스크 리스트 하위 태스크 목록 (order 정렬).
     */
    public static QueryDescriptor tasks(String projectId, String phaseId, String listId) {
        return collection("projects/" + projectId + "/phases/" + phaseId + "/lists/" + listId + "/tasks")
            .orderBy("order");
    }

    /**
     * 동등 필터를 추가한 새 쿼리 생성.
     *
     * @param field 필드명
     * @param value 비교 값 (null 불가)
     * @return 새 QueryDescriptor
     */
    public QueryDescriptor whereEqualTo(String field, Object value) {
        SortedMap<String, Object> filters = new TreeMap<>(equalityFilters);
        filters.put(requireField(field), requireValue(value));
        return new QueryDescriptor(collectionPath, documentId, filters, arrayContainsFilters, orderBy);
    }

    /**
     * 배열 포함 필터를 추가한 새 쿼리 생성.
     *
     * @param field 배열 필드명
     * @param value 포함 여부를 검사할 값 (null 불가)
     * @return 새 QueryDescriptor
     */
    public QueryDescriptor whereArrayContains(String field, Object value) {
        SortedMap<String, Object> filters = new TreeMap<>(arrayContainsFilters);
        filters.put(requireField(field), requireValue(value));
        return new QueryDescriptor(collectionPath, documentId, equalityFilters, filters, orderBy);
    }

    /**
     * 정렬 필드를 지정한 새 쿼리 생성.
     *
     * @param field 정렬 필드명
     * @return 새 QueryDescriptor
     */
    public QueryDescriptor orderBy(String field) {
        return new QueryDescriptor(collectionPath, documentId, equalityFilters, arrayContainsFilters, requireField(field));
    }

    /**
     * 단일 문서 쿼리인지 확인.
     *
     * @return documentId가 지정된 경우 true
     */
    public boolean isDocument() {
        return documentId != null;
    }

    /**
     * 정규화된 구독 키 생성.
     *
     * <p>형식: {@code path[@docId][?f=t:v&...][&~f=t:v...][#orderBy]}</p>
     *
     * <ul>
     *   <li>구분 문자({@code % ? & = # @ ~ :})는 모든 구성 요소에서, {@code /}는 경로 외의
     *       구성 요소에서 {@code %XX}로 인코딩</li>
     *   <li>값 타입 태그: {@code s:} 문자열, {@code n:} 숫자, {@code b:} 불리언,
     *       그 외 {@code o:클래스명:}</li>
     *   <li>숫자는 값으로 정규화 (1과 1.0은 같은 키, 원격 필터 비교와 동일)</li>
     * </ul>
     *
     * @return SubscriptionKey
     */
    public SubscriptionKey toKey() {
        StringBuilder sb = new StringBuilder();
        appendEscaped(sb, collectionPath, false);
        if (documentId != null) {
            sb.append('@');
            appendEscaped(sb, documentId, true);
        }
        char separator = '?';
        for (Map.Entry<String, Object> e : equalityFilters.entrySet()) {
            sb.append(separator);
            appendFilter(sb, e.getKey(), e.getValue());
            separator = '&';
        }
        for (Map.Entry<String, Object> e : arrayContainsFilters.entrySet()) {
            sb.append(separator).append('~');
            appendFilter(sb, e.getKey(), e.getValue());
            separator = '&';
        }
        if (orderBy != null) {
            sb.append('#');
            appendEscaped(sb, orderBy, true);
        }
        return SubscriptionKey.of(sb.toString());
    }

    private static void appendFilter(StringBuilder sb, String field, Object value) {
        appendEscaped(sb, field, true);
        sb.append('=');
        if (value instanceof String) {
            sb.append("s:");
            appendEscaped(sb, (String) value, true);
        } else if (value instanceof Number) {
            sb.append("n:");
            appendEscaped(sb, canonicalNumber((Number) value), true);
        } else if (value instanceof Boolean) {
            sb.append("b:").append(value);
        } else {
            sb.append("o:");
            appendEscaped(sb, value.getClass().getName(), true);
            sb.append(':');
            appendEscaped(sb, value.toString(), true);
        }
    }

    private static String canonicalNumber(Number number) {
        try {
            return new BigDecimal(number.toString()).stripTrailingZeros().toPlainString();
        } catch (NumberFormatException e) {
            // NaN, Infinity
            return number.toString();
        }
    }

    private static void appendEscaped(StringBuilder sb, String text, boolean escapeSlash) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (isReserved(c) || (escapeSlash && c == '/')) {
                sb.append('%').append(HEX[(c >> 4) & 0xF]).append(HEX[c & 0xF]);
            } else {
                sb.append(c);
            }
        }
    }

    private static boolean isReserved(char c) {
        switch (c) {
            case '%':
            case '?':
            case '&':
            case '=':
            case '#':
            case '@':
            case '~':
            case ':':
                return true;
            default:
                return false;
        }
    }

    private static SortedMap<String, Object> immutableCopy(Map<String, Object> source, String name) {
        if (source == null || source.isEmpty()) {
            return Collections.emptySortedMap();
        }
        SortedMap<String, Object> copy = new TreeMap<>();
        for (Map.Entry<String, Object> e : source.entrySet()) {
            if (e.getKey() == null || e.getValue() == null) {
                throw new IllegalArgumentException(name + " cannot contain null keys or values");
            }
            copy.put(e.getKey(), e.getValue());
        }
        return Collections.unmodifiableSortedMap(copy);
    }

    private static String requireField(String field) {
        if (field == null || field.isBlank()) {
            throw new IllegalArgumentException("field cannot be null or blank");
        }
        return field;
    }

    private static Object requireValue(Object value) {
        if (value == null) {
            throw new IllegalArgumentException("filter value cannot be null");
        }
        return value;
    }
}
