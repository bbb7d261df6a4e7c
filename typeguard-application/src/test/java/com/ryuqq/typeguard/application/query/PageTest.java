package com.ryuqq.typeguard.application.query;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Page 테스트.
 *
 * @author TypeGuard Team
 * @since 1.0.0
 */
class PageTest {

    @Test
    void slice_MiddlePage_ReturnsRequestedWindow() {
        // Given
        List<Integer> sorted = IntStream.rangeClosed(1, 25).boxed().collect(Collectors.toList());

        // When
        Page<Integer> page = Page.slice(sorted, 2, 10);

        // Then
        assertThat(page.items()).containsExactly(11, 12, 13, 14, 15, 16, 17, 18, 19, 20);
        assertThat(page.total()).isEqualTo(25);
        assertThat(page.pages()).isEqualTo(3);
        assertThat(page.hasNext()).isTrue();
    }

    @Test
    void slice_LastPartialPage_ReturnsRemainder() {
        Page<Integer> page = Page.slice(List.of(1, 2, 3, 4, 5), 2, 3);

        assertThat(page.items()).containsExactly(4, 5);
        assertThat(page.hasNext()).isFalse();
    }

    @Test
    void slice_BeyondLastPage_ReturnsEmptyItemsWithTotal() {
        Page<Integer> page = Page.slice(List.of(1, 2, 3), 5, 10);

        assertThat(page.items()).isEmpty();
        assertThat(page.total()).isEqualTo(3);
        assertThat(page.pages()).isEqualTo(1);
    }

    @Test
    void slice_EmptySet_HasZeroPages() {
        Page<Integer> page = Page.slice(List.of(), 1, 10);

        assertThat(page.pages()).isZero();
        assertThat(page.total()).isZero();
    }

    @Test
    void slice_AllPagesConcatenated_ReproduceFullSet() {
        // Given
        List<Integer> sorted = IntStream.range(0, 23).boxed().collect(Collectors.toList());
        int limit = 4;

        // When
        List<Integer> concatenated = new ArrayList<>();
        int pages = Page.slice(sorted, 1, limit).pages();
        for (int p = 1; p <= pages; p++) {
            concatenated.addAll(Page.slice(sorted, p, limit).items());
        }

        // Then
        assertThat(pages).isEqualTo(6);
        assertThat(concatenated).isEqualTo(sorted);
    }

    @Test
    void constructor_ItemsExceedLimit_ThrowsException() {
        assertThatThrownBy(() -> new Page<>(List.of(1, 2, 3), 1, 2, 3, 2))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("items exceed limit");
    }
}
