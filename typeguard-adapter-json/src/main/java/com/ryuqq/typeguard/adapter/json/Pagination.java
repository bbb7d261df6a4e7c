package com.ryuqq.typeguard.adapter.json;

import com.ryuqq.typeguard.application.query.Page;

/**
 * Wire form of page bounds.
 *
 * @param page 1-based page number
 * @param limit page size
 * @param total size of the full matching set
 * @param pages ceil(total / limit)
 * @author TypeGuard Team
 * @since 1.0.0
 */
public record Pagination(int page, int limit, int total, int pages) {

    public static Pagination of(Page<?> page) {
        return new Pagination(page.page(), page.limit(), page.total(), page.pages());
    }
}
