package com.fhi.my_pets.repo;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.stream.IntStream;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;


class OffsetLimitPageableTest
{
    @DisplayName("An offset that isn't a multiple of the page size is kept as is")
    @Test
    void unalignedOffset()
    {
        OffsetLimitPageable pageable = new OffsetLimitPageable(10, 12, Sort.by("id"));

        assertThat(pageable.getOffset()).isEqualTo(10);
        assertThat(pageable.getPageSize()).isEqualTo(12);
        assertThat(pageable.hasPrevious()).isTrue();
        assertThat(pageable.next().getOffset()).isEqualTo(22);
        assertThat(pageable.previousOrFirst().getOffset()).isZero();
        assertThat(pageable.first().getOffset()).isZero();
    }

    @DisplayName("A partial last page reports the total of the whole set")
    @Test
    void partialLastPage_total()
    {
        // GIVEN items 11 to 15 of 15
        Pageable pageable = new OffsetLimitPageable(10, 12, Sort.by("id"));
        List<Integer> content = IntStream.rangeClosed(11, 15).boxed().toList();

        // WHEN
        Page<Integer> page = new PageImpl<>(content, pageable, 15);

        // THEN
        assertThat(page.getContent()).hasSize(5);
        assertThat(page.getTotalElements()).isEqualTo(15);
    }

    @Test
    void invalidBounds()
    {
        assertThatThrownBy(() -> new OffsetLimitPageable(-1, 12, Sort.unsorted())).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new OffsetLimitPageable(0, 0, Sort.unsorted())).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void valueSemantics()
    {
        assertThat(new OffsetLimitPageable(5, 10, Sort.by("id")))
            .isEqualTo(new OffsetLimitPageable(5, 10, Sort.by("id")))
            .hasSameHashCodeAs(new OffsetLimitPageable(5, 10, Sort.by("id")))
            .isNotEqualTo(new OffsetLimitPageable(6, 10, Sort.by("id")));
    }
}
