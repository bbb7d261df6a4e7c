package com.ryuqq.typeguard.application.query;

import java.util.List;

/**
 * 페이지 단위 조회 결과.
 *
 * <p>{@code total}은 페이지 크기가 아닌 전체 대상 건수이며,
 * {@code pages}는 {@code ceil(total / limit)}입니다 (대상이 없으면 0).</p>
 *
 * @author TypeGuard Team
 * @since 1.0.0
 * @param items 현재 페이지 항목 (불변)
 * @param page 1부터 시작하는 페이지 번호
 * @param limit 페이지 크기
 * @param total 전체 건수
 * @param pages 전체 페이지 수
 * @param <T> 항목 타입
 */
public record Page<T>(
    List<T> items,
    int page,
    int limit,
    int total,
    int pages
) {

    public Page {
        if (items == null) {
            throw new IllegalArgumentException("items cannot be null");
        }
        if (page < 1) {
            throw new IllegalArgumentException("page must be at least 1 (current: " + page + ")");
        }
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be at least 1 (current: " + limit + ")");
        }
        if (total < 0) {
            throw new IllegalArgumentException("total cannot be negative (current: " + total + ")");
        }
        if (items.size() > limit) {
            throw new IllegalArgumentException(
                "items exceed limit (size: " + items.size() + ", limit: " + limit + ")");
        }
        items = List.copyOf(items);
    }

    /**
     * 정렬된 전체 목록에서 {@code [(page-1)*limit, page*limit)} 구간을 잘라 페이지를 만듭니다.
     *
     * @param sorted 정렬된 전체 목록
     * @param page 페이지 번호
     * @param limit 페이지 크기
     * @param <T> 항목 타입
     * @return 페이지
     */
    public static <T> Page<T> slice(List<T> sorted, int page, int limit) {
        int total = sorted.size();
        long from = (long) (page - 1) * limit;
        List<T> items = from >= total
            ? List.of()
            : sorted.subList((int) from, (int) Math.min(from + limit, total));
        return new Page<>(items, page, limit, total, pageCount(total, limit));
    }

    static int pageCount(int total, int limit) {
        return (int) (((long) total + limit - 1) / limit);
    }

    public boolean hasNext() {
        return page < pages;
    }
}
