package com.ryuqq.batchexec.core.support;

import org.slf4j.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * 고정 키를 가진 레코드 목록을 열 맞춤 표로 로깅.
 *
 * <p><strong>출력 규칙:</strong></p>
 * <ul>
 *   <li>정렬 키 열이 맨 앞, 나머지 열은 키 이름 순</li>
 *   <li>열 너비 = 헤더와 값 중 가장 긴 길이 + 1</li>
 *   <li>값은 maxWidth로 잘리며 잘린 경우 "..."로 끝남</li>
 *   <li>null 값은 "(undef)"로 표시</li>
 *   <li>행은 정렬 키의 문자열 순</li>
 * </ul>
 *
 * <p>첫 번째 레코드의 키 집합이 헤더가 됩니다.</p>
 *
 * @author BatchExec Team
 * @since 1.0.0
 */
public final class Tabulator {

    static final String UNDEFINED = "(undef)";
    private static final String ELLIPSIS = "...";

    private final Logger log;
    private final int maxWidth;

    /**
     * 생성자.
     *
     * @param log 출력 대상 로거
     * @param maxWidth 값의 최대 표시 길이 (ELLIPSIS 길이보다 커야 함)
     * @throws IllegalArgumentException 인자가 유효하지 않은 경우
     */
    public Tabulator(Logger log, int maxWidth) {
        if (log == null) {
            throw new IllegalArgumentException("log cannot be null");
        }
        if (maxWidth <= ELLIPSIS.length()) {
            throw new IllegalArgumentException(
                "maxWidth must be greater than " + ELLIPSIS.length() + " (current: " + maxWidth + ")"
            );
        }
        this.log = log;
        this.maxWidth = maxWidth;
    }

    /**
     * 표 출력.
     *
     * @param records 레코드 목록
     * @param sortKey 정렬 및 첫 열로 사용할 키
     * @return 출력한 레코드 수
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public int tabulate(List<Map<String, Object>> records, String sortKey) {
        if (records == null) {
            throw new IllegalArgumentException("records cannot be null");
        }
        if (sortKey == null) {
            throw new IllegalArgumentException("sortKey cannot be null");
        }
        if (records.isEmpty()) {
            return 0;
        }

        List<String> header = new ArrayList<>();
        TreeSet<String> rest = new TreeSet<>(records.get(0).keySet());
        if (rest.remove(sortKey)) {
            header.add(sortKey);
        }
        header.addAll(rest);

        int[] width = new int[header.size()];
        for (int i = 0; i < header.size(); i++) {
            width[i] = header.get(i).length();
        }

        List<Map<String, String>> rendered = new ArrayList<>(records.size());
        for (Map<String, Object> record : records) {
            Map<String, String> row = new LinkedHashMap<>();
            for (int i = 0; i < header.size(); i++) {
                String key = header.get(i);
                Object value = record.get(key);
                String text = value == null ? UNDEFINED : truncate(String.valueOf(value), maxWidth);
                width[i] = Math.max(width[i], text.length());
                row.put(key, text);
            }
            rendered.add(row);
        }
        rendered.sort(Comparator.comparing(row -> row.getOrDefault(sortKey, "")));

        log.info(line(header, width, null));
        for (Map<String, String> row : rendered) {
            log.info(line(header, width, row));
        }
        return records.size();
    }

    /**
     * 문자열 자르기.
     *
     * @param text 원본 문자열
     * @param max 최대 길이 (ELLIPSIS 포함)
     * @return max 이하 길이의 문자열
     * @throws IllegalArgumentException text가 null이거나 max가 ELLIPSIS 길이 이하인 경우
     */
    public static String truncate(String text, int max) {
        if (text == null) {
            throw new IllegalArgumentException("text cannot be null");
        }
        if (max <= ELLIPSIS.length()) {
            throw new IllegalArgumentException(
                "max must be greater than " + ELLIPSIS.length() + " (current: " + max + ")"
            );
        }
        if (text.length() <= max) {
            return text;
        }
        return text.substring(0, max - ELLIPSIS.length()) + ELLIPSIS;
    }

    private static String line(List<String> header, int[] width, Map<String, String> row) {
        StringBuilder line = new StringBuilder();
        for (int i = 0; i < header.size(); i++) {
            String cell = row == null ? header.get(i) : row.get(header.get(i));
            line.append(String.format("%-" + (width[i] + 1) + "s", cell));
        }
        return line.toString();
    }
}
